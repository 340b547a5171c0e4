package com.github.spud.sample.ai.agentic.citation;

import com.github.spud.sample.ai.agentic.rag.RetrievedPassage;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * 引用服务 从检索结果提取来源、向提示词注入编号来源、校验回答中的 [n] 引用并追加来源列表
 */
@Slf4j
@Service
public class CitationService {

  private static final Pattern CITATION = Pattern.compile("\\[(\\d+)]");

  private static final String GUIDELINES = """
    ## Citation Guidelines
    - Cite the sources below inline with their number, e.g. [1] or [2].
    - Only cite a source when the statement is supported by it.
    - Never invent source numbers that are not listed.
    """;

  public List<CitationSource> extractSources(List<RetrievedPassage> passages) {
    if (passages == null || passages.isEmpty()) {
      return List.of();
    }
    List<CitationSource> sources = new ArrayList<>(passages.size());
    for (int i = 0; i < passages.size(); i++) {
      RetrievedPassage passage = passages.get(i);
      String title = passage.title();
      String url = firstNonBlank(passage.metadataText("url"), passage.metadataText("source_url"));
      String date = firstNonBlank(passage.metadataText("date"),
        passage.metadataText("scraped_at"));
      String category = firstNonBlank(passage.metadataText("category"), passage.collection());
      sources.add(new CitationSource(
        i + 1,
        title != null && !title.isBlank() ? title : "Document " + (i + 1),
        url != null ? url : "",
        date,
        category,
        passage.score(),
        CitationSource.TYPE_RAG));
    }
    return sources;
  }

  /**
   * 把引用规范和可用来源追加到系统提示词，没有来源时原样返回
   */
  public String injectCitationContext(String systemPrompt, List<CitationSource> sources) {
    if (sources == null || sources.isEmpty()) {
      return systemPrompt;
    }
    StringBuilder sb = new StringBuilder(systemPrompt == null ? "" : systemPrompt);
    sb.append("\n\n").append(GUIDELINES).append("\n## Available Sources\n");
    for (CitationSource source : sources) {
      sb.append('[').append(source.id()).append("] ").append(source.title());
      if (source.category() != null && !source.category().isBlank()) {
        sb.append(" (Category: ").append(source.category()).append(')');
      }
      sb.append('\n');
    }
    return sb.toString();
  }

  public CitationValidation validateCitations(String response, List<CitationSource> sources) {
    Set<Integer> found = new TreeSet<>();
    if (response != null) {
      Matcher matcher = CITATION.matcher(response);
      while (matcher.find()) {
        try {
          found.add(Integer.parseInt(matcher.group(1)));
        } catch (NumberFormatException e) {
          log.debug("Ignoring oversized citation marker: {}", matcher.group());
        }
      }
    }
    Set<Integer> available = sources == null ? Set.of()
      : sources.stream().map(CitationSource::id).collect(Collectors.toCollection(TreeSet::new));

    List<Integer> invalid = found.stream().filter(id -> !available.contains(id)).toList();
    List<Integer> unused = available.stream().filter(id -> !found.contains(id)).toList();
    double rate = available.isEmpty() ? 0.0
      : (double) (found.size() - invalid.size()) / available.size();

    return new CitationValidation(invalid.isEmpty(), List.copyOf(found), invalid, unused, rate);
  }

  public String formatSourcesSection(List<CitationSource> sources) {
    if (sources == null || sources.isEmpty()) {
      return "";
    }
    StringBuilder sb = new StringBuilder("**Sources:**\n");
    for (CitationSource source : sources) {
      sb.append('[').append(source.id()).append("] ").append(source.title());
      if (source.url() != null && !source.url().isBlank()) {
        sb.append(" - ").append(source.url());
      }
      if (source.date() != null && !source.date().isBlank()) {
        String date = source.date();
        sb.append(" - ").append(date.length() > 10 ? date.substring(0, 10) : date);
      }
      sb.append('\n');
    }
    return sb.toString().stripTrailing();
  }

  /**
   * 追加来源列表；给出校验结果时只保留被引用的来源
   */
  public String appendSources(String response, List<CitationSource> sources,
    CitationValidation validation) {
    if (sources == null || sources.isEmpty()) {
      return response;
    }
    List<CitationSource> cited = sources;
    if (validation != null) {
      cited = sources.stream()
        .filter(source -> validation.citationsFound().contains(source.id()))
        .toList();
    }
    if (cited.isEmpty()) {
      return response;
    }
    return response + "\n\n" + formatSourcesSection(cited);
  }

  private static String firstNonBlank(String first, String second) {
    if (first != null && !first.isBlank()) {
      return first;
    }
    return second != null && !second.isBlank() ? second : null;
  }
}
