package com.signalwatch.scan.extract;

import com.signalwatch.scan.model.DocumentContent;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.Locale;

/**
 * Plain text of a downloaded filing document. PDFs go through PDFBox, XHTML/iXBRL through jsoup
 * with block boundaries kept as line breaks so the line-bounded date phrases still match.
 */
@Component
public class DocumentTextReader {
    private static final Logger log = LoggerFactory.getLogger(DocumentTextReader.class);
    private static final String BLOCK_ELEMENTS = "p, div, br, tr, li, td, th, h1, h2, h3, h4, h5, h6, table, section";

    public String read(DocumentContent content) throws IOException {
        if (content == null || content.body() == null || content.body().length == 0) {
            return "";
        }
        if (content.isPdf()) {
            return readPdf(content);
        }
        if (content.isMarkup() || looksLikeMarkup(content)) {
            return readMarkup(content.bodyAsString());
        }
        return content.bodyAsString();
    }

    private String readPdf(DocumentContent content) throws IOException {
        try (PDDocument document = PDDocument.load(content.body())) {
            log.debug("Reading {} PDF pages from document {}", document.getNumberOfPages(), content.documentId());
            return new PDFTextStripper().getText(document);
        }
    }

    static String readMarkup(String markup) {
        Document document = Jsoup.parse(markup);
        document.select("script, style, head").remove();
        document.select(BLOCK_ELEMENTS).after("\n");
        String text = document.body() == null ? document.wholeText() : document.body().wholeText();
        return text
            .replaceAll("[ \\t\\x0B\\f\\r\\u00A0]+", " ")
            .replaceAll(" ?\\n ?", "\n")
            .replaceAll("\\n{3,}", "\n\n")
            .trim();
    }

    private static boolean looksLikeMarkup(DocumentContent content) {
        String head = content.bodyAsString();
        head = head.substring(0, Math.min(head.length(), 512)).trim().toLowerCase(Locale.ROOT);
        return head.startsWith("<?xml") || head.startsWith("<!doctype html") || head.startsWith("<html");
    }
}
