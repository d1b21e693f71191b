package com.delta.cnpjresolver.resolve.service;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CsvCompanySourceTest {
    private final CsvCompanySource source = new CsvCompanySource();

    @TempDir
    Path tempDir;

    @Test
    void readsCompanyColumnInOrderWithoutDuplicates() throws Exception {
        Path input = tempDir.resolve("companies.csv");
        Files.writeString(input, "\uFEFF" + """
            sector,company_name
            aviation,Embraer S.A.
            banking,"Itaú Unibanco Holding S.A."
            cosmetics,  Natura &Co
            aviation,Embraer S.A.
            energy,
            """, StandardCharsets.UTF_8);

        assertThat(source.read(input))
            .containsExactly("Embraer S.A.", "Itaú Unibanco Holding S.A.", "Natura &Co");
    }

    @Test
    void missingColumnFails() throws Exception {
        Path input = tempDir.resolve("companies.csv");
        Files.writeString(input, "name\nEmbraer\n", StandardCharsets.UTF_8);

        assertThatThrownBy(() -> source.read(input))
            .isInstanceOf(ResolutionException.class)
            .hasMessageContaining("company_name");
    }

    @Test
    void missingFileFails() {
        assertThatThrownBy(() -> source.read(tempDir.resolve("absent.csv")))
            .isInstanceOf(ResolutionException.class)
            .hasMessageContaining("not found");
    }
}
