// Copyright The Retry Executor Authors. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package io.github.retryexecutor;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;

class SourceHeaderTest {

    private static final List<String> HEADER = List.of(
            "// Copyright The Retry Executor Authors. All Rights Reserved.", "// SPDX-License-Identifier: Apache-2.0");

    @Test
    void testEverySourceFileCarriesProjectLicenseHeader() throws IOException {
        List<Path> sources;
        try (Stream<Path> files =
                Stream.concat(Files.walk(Path.of("src/main/java")), Files.walk(Path.of("src/test/java")))) {
            sources = files.filter(path -> path.toString().endsWith(".java")).collect(Collectors.toList());
        }

        assertFalse(sources.isEmpty());
        for (var source : sources) {
            var lines = Files.readAllLines(source);
            assertTrue(lines.size() >= 2, source + " is too short");
            assertEquals(HEADER, lines.subList(0, 2), "Unexpected header in " + source);
        }
    }
}
