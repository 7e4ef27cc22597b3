package com.example.catalogsync.source;

import com.example.catalogsync.config.SourceApiConfig;
import com.example.catalogsync.config.SyncConfig;
import com.example.catalogsync.family.LawFamily;
import com.example.catalogsync.model.ChildItem;
import com.example.catalogsync.model.SourceRecord;
import com.example.catalogsync.service.OdsClient;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.util.HtmlUtils;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads the current laws of the legal registry. The paragraphs of each law are parsed from
 * its HTML law text.
 */
@Component
public class LawSourceReader implements SourceReader {

    private static final Logger log = LoggerFactory.getLogger(LawSourceReader.class);

    private static final Pattern PARAGRAPH = Pattern.compile(
            "<div class=['\"]article['\"]>\\s*"
                    + "<div class=['\"]article_number['\"]>.*?"
                    + "<span class=['\"]article_symbol['\"]>.*?</span>\\s*"
                    + "<span class=['\"]number['\"]>(?<code>.*?)</span>.*?</div>\\s*"
                    + "<div class=['\"]article_title['\"]>.*?"
                    + "<span class=['\"]title_text['\"]>(?<title>.*?)</span>.*?</div>\\s*"
                    + "</div>",
            Pattern.DOTALL | Pattern.CASE_INSENSITIVE);

    private static final Pattern TAG = Pattern.compile("<[^>]+>");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final OdsClient odsClient;
    private final SourceApiConfig sourceConfig;

    public LawSourceReader(OdsClient odsClient, SourceApiConfig sourceConfig) {
        this.odsClient = odsClient;
        this.sourceConfig = sourceConfig;
    }

    @Override
    public String getFamily() {
        return SyncConfig.LAWS;
    }

    @Override
    public List<SourceRecord> read() {
        return toRecords(odsClient.fetchRecords(sourceConfig.getLawsDatasetId(), sourceConfig.getLawsFilter()));
    }

    public List<SourceRecord> toRecords(List<JsonNode> rows) {
        List<SourceRecord> records = new ArrayList<>();
        for (JsonNode row : rows) {
            String systematicNumber = LawFamily.normalizeSystematicNumber(text(row, "systematic_number"));
            String title = text(row, "title_de");
            if (systematicNumber.isEmpty() || title.isEmpty()) {
                log.warn("Skipping law without systematic number or title: systematic_number='{}', title_de='{}'",
                        systematicNumber, title);
                continue;
            }

            SourceRecord.SourceRecordBuilder builder = SourceRecord.builder()
                    .naturalKey(systematicNumber)
                    .field("title_de", title)
                    .field("original_url_de", text(row, "original_url_de"));
            parseParagraphs(text(row, "gesetzestext_html")).forEach(builder::child);
            records.add(builder.build());
        }
        log.info("Read {} laws", records.size());
        return records;
    }

    /**
     * Extract the paragraphs of an HTML law text. Paragraphs without a number are ignored and
     * only the first occurrence of a repeated number is kept.
     */
    public static List<ChildItem> parseParagraphs(String html) {
        List<ChildItem> paragraphs = new ArrayList<>();
        if (html == null || html.isBlank()) {
            return paragraphs;
        }
        Set<String> seen = new LinkedHashSet<>();
        Matcher matcher = PARAGRAPH.matcher(html);
        while (matcher.find()) {
            String code = stripHtml(matcher.group("code"));
            if (code.isEmpty() || !seen.add(code)) {
                continue;
            }
            String shortText = stripHtml(matcher.group("title"));
            if ("§".equals(shortText) || "\uFFFD".equals(shortText)) {
                shortText = "";
            }
            paragraphs.add(ChildItem.builder()
                    .code(code)
                    .value("shortText", shortText)
                    .build());
        }
        return paragraphs;
    }

    static String stripHtml(String fragment) {
        if (fragment == null) {
            return "";
        }
        String text = TAG.matcher(fragment).replaceAll("");
        text = HtmlUtils.htmlUnescape(text).replace('\u00A0', ' ');
        return WHITESPACE.matcher(text).replaceAll(" ").trim();
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? "" : value.asText().trim();
    }
}
