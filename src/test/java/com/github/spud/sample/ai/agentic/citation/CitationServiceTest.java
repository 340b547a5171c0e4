package com.github.spud.sample.ai.agentic.citation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.github.spud.sample.ai.agentic.rag.RetrievedPassage;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * 引用服务测试
 */
class CitationServiceTest {

  private CitationService citationService;
  private List<CitationSource> sources;

  @BeforeEach
  void setUp() {
    citationService = new CitationService();
    sources = citationService.extractSources(List.of(
      new RetrievedPassage("p1", "KITAS rules", Map.of(
        "title", "Immigration Regulation 22/2023",
        "url", "https://imigrasi.go.id/reg-22",
        "scraped_at", "2024-03-05T10:11:12Z",
        "category", "immigration"), 0.91, "visa_oracle"),
      new RetrievedPassage("p2", "VAT 12%", Map.of(
        "source_url", "https://pajak.go.id/vat"), 0.82, "tax_updates")));
  }

  @Test
  void shouldExtractNumberedSources() {
    assertEquals(2, sources.size());

    CitationSource first = sources.get(0);
    assertEquals(1, first.id());
    assertEquals("Immigration Regulation 22/2023", first.title());
    assertEquals("https://imigrasi.go.id/reg-22", first.url());
    assertEquals("2024-03-05T10:11:12Z", first.date());
    assertEquals("immigration", first.category());
    assertEquals(CitationSource.TYPE_RAG, first.type());

    CitationSource second = sources.get(1);
    assertEquals(2, second.id());
    assertEquals("Document 2", second.title());
    assertEquals("https://pajak.go.id/vat", second.url());
    assertEquals("tax_updates", second.category());
  }

  @Test
  void shouldInjectCitationContext() {
    String prompt = citationService.injectCitationContext("You are Zantara.", sources);

    assertThat(prompt)
      .startsWith("You are Zantara.")
      .contains("## Citation Guidelines")
      .contains("[1] Immigration Regulation 22/2023 (Category: immigration)")
      .contains("[2] Document 2 (Category: tax_updates)");
  }

  @Test
  void shouldLeavePromptUntouchedWithoutSources() {
    String prompt = "You are Zantara.";

    assertSame(prompt, citationService.injectCitationContext(prompt, List.of()));
  }

  @Test
  void shouldValidateCitations() {
    CitationValidation validation = citationService.validateCitations(
      "KITAS is required [1]. See also [1] and [7].", sources);

    assertFalse(validation.valid());
    assertEquals(List.of(1, 7), validation.citationsFound());
    assertEquals(List.of(7), validation.invalidCitations());
    assertEquals(List.of(2), validation.unusedSources());
    assertEquals(0.5, validation.citationRate());
    assertTrue(validation.hasCitations());
  }

  @Test
  void shouldComputeCitationRate() {
    CitationValidation validation = citationService.validateCitations("Both apply [1][2].",
      sources);

    assertTrue(validation.valid());
    assertEquals(1.0, validation.citationRate());
  }

  @Test
  void shouldAppendOnlyCitedSources() {
    String answer = "You need a KITAS [1].";
    CitationValidation validation = citationService.validateCitations(answer, sources);

    String withSources = citationService.appendSources(answer, sources, validation);

    assertEquals("You need a KITAS [1].\n\n**Sources:**\n"
      + "[1] Immigration Regulation 22/2023 - https://imigrasi.go.id/reg-22 - 2024-03-05",
      withSources);
  }

  @Test
  void shouldNotAppendWhenNothingCited() {
    String answer = "You need a KITAS.";
    CitationValidation validation = citationService.validateCitations(answer, sources);

    assertEquals(answer, citationService.appendSources(answer, sources, validation));
    assertEquals(answer, citationService.appendSources(answer, List.of(), null));
  }

  @Test
  void shouldFormatAllSourcesWithoutValidation() {
    String withSources = citationService.appendSources("Answer", sources, null);

    assertThat(withSources).contains("[1] Immigration Regulation 22/2023")
      .endsWith("[2] Document 2 - https://pajak.go.id/vat");
  }
}
