package com.delta.cnpjresolver.resolve.branch;

import com.delta.cnpjresolver.resolve.model.BranchEntry;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class BranchListingParserTest {
    private final BranchListingParser parser = new BranchListingParser();

    @Test
    void parsesRowsAndSkipsInvalidOnes() {
        String html = """
            <html><body>
              <div class="row-list">
                <h5 class="socio">Matriz</h5>
                <p class="det">CNPJ: 07.689.002/0001-89 - São José dos Campos</p>
              </div>
              <div class="row-list">
                <h5 class="socio"> Filial </h5>
                <p class="det">CNPJ: 07.689.002/0002-60</p>
              </div>
              <div class="row-list">
                <h5 class="socio">Filial</h5>
                <p class="det">CNPJ: 07.689.002/0002-99</p>
              </div>
              <div class="row-list">
                <p class="det">CNPJ: 07.689.002/0003-40</p>
              </div>
              <div class="row-list">
                <h5 class="socio">Filial</h5>
                <p class="det">sem cnpj</p>
              </div>
            </body></html>
            """;

        BranchListingParser.BranchPage page = parser.parse(html, "https://www.diretoriobrasil.net/filiais/embraer-sa-07689002000189.html");

        assertThat(page.entries()).extracting(BranchEntry::label).containsExactly("Matriz", "Filial");
        assertThat(page.entries()).extracting(entry -> entry.cnpj().formatted())
            .containsExactly("07.689.002/0001-89", "07.689.002/0002-60");
    }

    @Test
    void collectsPaginationLinksSortedAndAbsolute() {
        String html = """
            <html><body>
              <div class="row-list"><h5 class="socio">Filial</h5><p class="det">07.689.002/0002-60</p></div>
              <nav aria-label="Resultado da busca">
                <ul class="pagination">
                  <li class="disabled"><a href="?p=1">Anterior</a></li>
                  <li><a href="embraer-sa-07689002000189.html?p=3">3</a></li>
                  <li><a href="embraer-sa-07689002000189.html?p=2">2</a></li>
                  <li><a class="disabled" href="?p=9">9</a></li>
                  <li><a href="/sobre">Sobre</a></li>
                </ul>
              </nav>
              <a href="?p=7">outside the nav</a>
            </body></html>
            """;

        BranchListingParser.BranchPage page = parser.parse(html, "https://www.diretoriobrasil.net/filiais/embraer-sa-07689002000189.html");

        assertThat(page.pageLinks()).containsExactly(
            "https://www.diretoriobrasil.net/filiais/embraer-sa-07689002000189.html?p=2",
            "https://www.diretoriobrasil.net/filiais/embraer-sa-07689002000189.html?p=3"
        );
    }

    @Test
    void ignoresLinksWithoutPageParameter() {
        String html = """
            <nav aria-label="Resultado da busca">
              <a href="?sp=2">busca</a>
              <a href="?op=3">ordem</a>
              <a href="?ordem=nome&p=4#topo">4</a>
            </nav>
            """;

        BranchListingParser.BranchPage page = parser.parse(html, "https://www.diretoriobrasil.net/filiais/natura-co-11222333000181.html");

        assertThat(page.pageLinks()).containsExactly(
            "https://www.diretoriobrasil.net/filiais/natura-co-11222333000181.html?ordem=nome&p=4#topo"
        );
        assertThat(BranchListingParser.hasPageParameter("lista.html?sp=2&x=1")).isFalse();
        assertThat(BranchListingParser.hasPageParameter("lista.html?x=1&p=2")).isTrue();
    }

    @Test
    void emptyPageContributesNothing() {
        BranchListingParser.BranchPage page = parser.parse("<html><body><p>Nenhuma empresa</p></body></html>", null);

        assertThat(page.entries()).isEmpty();
        assertThat(page.pageLinks()).isEmpty();
    }
}
