package assistant.adapter.out.kubernetes;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@DisplayName("MountedServiceAccountCredentials")
class MountedServiceAccountCredentialsTest {

    @TempDir
    Path mountDir;

    @Test
    @DisplayName("should read and trim the mounted files")
    void shouldReadTrimmedValues() throws IOException {
        var token = Files.writeString(mountDir.resolve("token"), "eyJhbGciOi.sa-token\n");
        var namespace = Files.writeString(mountDir.resolve("namespace"), "  assistant\n");

        var credentials = new MountedServiceAccountCredentials(token, namespace);

        assertEquals(Optional.of("eyJhbGciOi.sa-token"), credentials.token());
        assertEquals(Optional.of("assistant"), credentials.namespace());
    }

    @Test
    @DisplayName("should return empty when nothing is mounted")
    void shouldReturnEmptyWhenMissing() {
        var credentials = new MountedServiceAccountCredentials(
                mountDir.resolve("token"), mountDir.resolve("namespace"));

        assertTrue(credentials.token().isEmpty());
        assertTrue(credentials.namespace().isEmpty());
    }

    @Test
    @DisplayName("should treat blank files as absent")
    void shouldTreatBlankAsAbsent() throws IOException {
        var token = Files.writeString(mountDir.resolve("token"), "   \n");

        var credentials = new MountedServiceAccountCredentials(token, mountDir.resolve("namespace"));

        assertTrue(credentials.token().isEmpty());
    }

    @Test
    @DisplayName("should treat a directory at the token path as absent")
    void shouldIgnoreDirectories() throws IOException {
        var directory = Files.createDirectory(mountDir.resolve("token"));

        var credentials = new MountedServiceAccountCredentials(directory, mountDir.resolve("namespace"));

        assertTrue(credentials.token().isEmpty());
    }
}
