package com.delta.cnpjresolver.resolve.branch;

import com.delta.cnpjresolver.resolve.model.BranchEntry;
import com.delta.cnpjresolver.resolve.model.Cnpj;
import com.delta.cnpjresolver.resolve.util.CnpjValidator;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.TreeSet;
import java.util.regex.Matcher;

/**
 * Reads branch rows and pagination links from a directory listing page.
 */
@Component
public class BranchListingParser {
    private static final String PAGINATION_SELECTOR = "nav[aria-label='Resultado da busca'] a[href]";

    public BranchPage parse(String html, String pageUrl) {
        if (html == null || html.isBlank()) {
            return new BranchPage(List.of(), List.of());
        }
        Document document = pageUrl == null ? Jsoup.parse(html) : Jsoup.parse(html, pageUrl);
        return new BranchPage(parseEntries(document), parsePageLinks(document));
    }

    List<BranchEntry> parseEntries(Document document) {
        List<BranchEntry> entries = new ArrayList<>();
        for (Element row : document.select("div.row-list")) {
            Element label = row.selectFirst("h5.socio");
            Element detail = row.selectFirst("p.det");
            if (label == null || detail == null) {
                continue;
            }
            Matcher matcher = CnpjValidator.PUNCTUATED.matcher(detail.text());
            if (!matcher.find()) {
                continue;
            }
            Optional<Cnpj> cnpj = Cnpj.parse(matcher.group());
            cnpj.ifPresent(value -> entries.add(new BranchEntry(label.text().trim(), value)));
        }
        return entries;
    }

    List<String> parsePageLinks(Document document) {
        TreeSet<String> links = new TreeSet<>();
        for (Element anchor : document.select(PAGINATION_SELECTOR)) {
            if (anchor.hasClass("disabled")) {
                continue;
            }
            Element parent = anchor.parent();
            if (parent != null && parent.hasClass("disabled")) {
                continue;
            }
            String href = anchor.attr("href");
            if (!hasPageParameter(href)) {
                continue;
            }
            String absolute = anchor.absUrl("href");
            links.add(absolute.isBlank() ? href : absolute);
        }
        return new ArrayList<>(links);
    }

    static boolean hasPageParameter(String href) {
        int query = href.indexOf('?');
        if (query < 0) {
            return false;
        }
        int fragment = href.indexOf('#', query);
        String params = fragment < 0 ? href.substring(query + 1) : href.substring(query + 1, fragment);
        for (String pair : params.split("&")) {
            if (pair.startsWith("p=")) {
                return true;
            }
        }
        return false;
    }

    public record BranchPage(List<BranchEntry> entries, List<String> pageLinks) {
    }
}
