package com.feedwatch.unit.credential;

import static org.assertj.core.api.Assertions.assertThat;

import com.feedwatch.credential.CredentialRotator;
import com.feedwatch.domain.model.Credential;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class CredentialRotatorTest {

    private final CredentialRotator rotator = new CredentialRotator();

    private final Credential primary = Credential.builder().id("primary").apiKey("aaaa1111").build();
    private final Credential secondary = Credential.builder().id("secondary").apiKey("bbbb2222").build();
    private final Credential tertiary = Credential.builder().id("tertiary").apiKey("cccc3333").build();

    @Test
    @DisplayName("Returns the credential after the current one")
    void next() {
        assertThat(rotator.nextCredential(List.of(primary, secondary, tertiary), "primary"))
                .contains(secondary);
    }

    @Test
    @DisplayName("Wraps from the last credential to the first")
    void wrapsAround() {
        assertThat(rotator.nextCredential(List.of(primary, secondary, tertiary), "tertiary"))
                .contains(primary);
    }

    @Test
    @DisplayName("Unknown or missing id falls back to the first credential")
    void unknownFallsBack() {
        assertThat(rotator.nextCredential(List.of(primary, secondary), "retired")).contains(primary);
        assertThat(rotator.nextCredential(List.of(primary, secondary), null)).contains(primary);
    }

    @Test
    @DisplayName("Single credential rotates to itself")
    void singleCredential() {
        assertThat(rotator.nextCredential(List.of(primary), "primary")).contains(primary);
    }

    @Test
    @DisplayName("No credentials yields nothing")
    void empty() {
        assertThat(rotator.nextCredential(List.of(), "primary")).isEmpty();
        assertThat(rotator.nextCredential(null, "primary")).isEmpty();
    }
}
