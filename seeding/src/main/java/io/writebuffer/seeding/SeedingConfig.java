package io.writebuffer.seeding;

import io.writebuffer.config.WriteBufferConfig;

import java.nio.file.Path;

public record SeedingConfig(
        Path inputDir,
        String jdbcUrl,
        String jdbcUser,
        String jdbcPassword,
        String table,
        Path journalFile,
        Path deadLetterFile,
        int adminPort,
        WriteBufferConfig buffer
) {
    /** A negative port disables the admin server. */
    public boolean adminEnabled() { return adminPort >= 0; }
}
