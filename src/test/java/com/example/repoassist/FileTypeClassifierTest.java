package com.example.repoassist;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

public class FileTypeClassifierTest {

    @TempDir
    Path tempDir;

    private final FileTypeClassifier classifier = new FileTypeClassifier();

    @Test
    public void classifiesByExtensionAndName() {
        assertThat(classifier.kindOf("src/App.java")).isEqualTo(FileKind.CODE);
        assertThat(classifier.kindOf("README")).isEqualTo(FileKind.DOCS);
        assertThat(classifier.kindOf("docs/setup.txt")).isEqualTo(FileKind.DOCS);
        assertThat(classifier.kindOf("docs/diagram.png")).isEqualTo(FileKind.BINARY);
        assertThat(classifier.kindOf("config/app.yaml")).isEqualTo(FileKind.CONFIG);
        assertThat(classifier.kindOf("Makefile")).isEqualTo(FileKind.OTHER_TEXT);
    }

    @Test
    public void mapsLanguages() {
        assertThat(classifier.languageOf("a/b.py")).isEqualTo("python");
        assertThat(classifier.languageOf("x.tsx")).isEqualTo("typescript");
        assertThat(classifier.languageOf("NOTES.md")).isEqualTo("markdown");
        assertThat(classifier.languageOf("Dockerfile")).isEqualTo("text");
        assertThat(classifier.languageOf("build.sbt")).isEqualTo("sbt");
    }

    @Test
    public void sniffsBinaryContent() throws Exception {
        Path text = tempDir.resolve("utf8.txt");
        Files.write(text, "grüße, 東京\n".getBytes(StandardCharsets.UTF_8));
        Path nul = tempDir.resolve("blob.dat");
        Files.write(nul, new byte[]{'a', 0, 'b'});
        Path latin1 = tempDir.resolve("latin1.txt");
        Files.write(latin1, new byte[]{'c', 'a', 'f', (byte) 0xE9, '\n'});

        assertThat(classifier.looksBinary(text)).isFalse();
        assertThat(classifier.looksBinary(nul)).isTrue();
        assertThat(classifier.looksBinary(latin1)).isTrue();
    }
}
