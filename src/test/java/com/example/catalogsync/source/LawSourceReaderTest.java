package com.example.catalogsync.source;

import com.example.catalogsync.model.ChildItem;
import com.example.catalogsync.model.SourceRecord;
import com.example.catalogsync.service.OdsClient;
import com.example.catalogsync.test.TestUtils;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class LawSourceReaderTest {

    private static final String LAW_HTML = """
        <div class="article">
          <div class="article_number"><span class="article_symbol">§</span> <span class="number">1</span></div>
          <div class="article_title"><span class="title_text">Zweck&nbsp;und <i>Gegenstand</i></span></div>
        </div>
        <p>Dieses Gesetz regelt ...</p>
        <div class='article'>
          <div class='article_number'><span class='article_symbol'>§</span> <span class='number'>2<sup>a</sup></span></div>
          <div class='article_title'><span class='title_text'>§</span></div>
        </div>
        <div class="article">
          <div class="article_number"><span class="article_symbol">§</span> <span class="number">1</span></div>
          <div class="article_title"><span class="title_text">Wiederholung</span></div>
        </div>
        <div class="article">
          <div class="article_number"><span class="article_symbol">§</span> <span class="number"> </span></div>
          <div class="article_title"><span class="title_text">Ohne Nummer</span></div>
        </div>
        """;

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Mock
    private OdsClient odsClient;

    @Test
    void testParseParagraphs() {
        List<ChildItem> paragraphs = LawSourceReader.parseParagraphs(LAW_HTML);

        assertEquals(2, paragraphs.size());
        assertEquals("1", paragraphs.get(0).getCode());
        assertEquals("Zweck und Gegenstand", paragraphs.get(0).value("shortText"));
        assertEquals("2a", paragraphs.get(1).getCode());
        assertEquals("", paragraphs.get(1).value("shortText"));
    }

    @Test
    void testParseParagraphs_EmptyText() {
        assertTrue(LawSourceReader.parseParagraphs(null).isEmpty());
        assertTrue(LawSourceReader.parseParagraphs("<p>Aufgehoben</p>").isEmpty());
    }

    @Test
    void testStripHtml() {
        assertEquals("A & B", LawSourceReader.stripHtml("<b>A</b>\n  &amp;   B "));
    }

    @Test
    void testRead_NormalizesKeysAndSkipsIncompleteRecords() throws Exception {
        JsonNode complete = objectMapper.createObjectNode()
                .put("systematic_number", " \"152.100\" ")
                .put("title_de", "Gesetz über die Information und den Datenschutz")
                .put("original_url_de", "https://www.gesetzessammlung.bs.ch/app/de/texts_of_law/153.260")
                .put("gesetzestext_html", LAW_HTML);
        JsonNode withoutNumber = objectMapper.readTree("{\"systematic_number\": null, \"title_de\": \"Ohne\"}");
        JsonNode withoutTitle = objectMapper.readTree("{\"systematic_number\": \"111.100\", \"title_de\": \"\"}");
        when(odsClient.fetchRecords("100354", "is_active=true AND info_badge='current'"))
                .thenReturn(List.of(complete, withoutNumber, withoutTitle));

        LawSourceReader reader = new LawSourceReader(odsClient, TestUtils.sourceApiConfig("http://localhost"));
        List<SourceRecord> records = reader.read();

        assertEquals(1, records.size());
        SourceRecord law = records.get(0);
        assertEquals("152.100", law.getNaturalKey());
        assertEquals("Gesetz über die Information und den Datenschutz", law.field("title_de"));
        assertEquals(2, law.getChildren().size());
        assertEquals("laws", reader.getFamily());
    }
}
