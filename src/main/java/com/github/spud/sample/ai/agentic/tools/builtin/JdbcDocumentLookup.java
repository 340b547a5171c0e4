package com.github.spud.sample.ai.agentic.tools.builtin;

import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Component;

/**
 * 基于 JdbcTemplate 的文档查询 parent_documents 存放全文，kg_relationships 存放实体关系
 */
@Component
@RequiredArgsConstructor
public class JdbcDocumentLookup implements DocumentLookup {

  private static final RowMapper<ParentDocument> DOCUMENT_MAPPER = (rs, rowNum) ->
    new ParentDocument(rs.getString("document_id"), rs.getString("title"),
      rs.getString("summary"), rs.getString("full_text"));

  private final JdbcTemplate jdbcTemplate;

  @Override
  public Optional<ParentDocument> findByTitle(String titleFragment) {
    List<ParentDocument> rows = jdbcTemplate.query("""
        SELECT document_id, title, summary, full_text
        FROM parent_documents
        WHERE title ILIKE ?
        LIMIT 1
        """, DOCUMENT_MAPPER, "%" + titleFragment + "%");
    return rows.stream().findFirst();
  }

  @Override
  public Optional<ParentDocument> findById(String documentId) {
    List<ParentDocument> rows = jdbcTemplate.query("""
        SELECT document_id, title, summary, full_text
        FROM parent_documents
        WHERE document_id = ? OR CAST(id AS TEXT) = ?
        LIMIT 1
        """, DOCUMENT_MAPPER, documentId, documentId);
    return rows.stream().findFirst();
  }

  @Override
  public List<EntityRelation> findRelationships(String entity, int limit) {
    return jdbcTemplate.query("""
        SELECT source_entity, relationship_type, target_entity
        FROM kg_relationships
        WHERE source_entity ILIKE ? OR target_entity ILIKE ?
        LIMIT ?
        """,
      (rs, rowNum) -> new EntityRelation(rs.getString("source_entity"),
        rs.getString("relationship_type"), rs.getString("target_entity")),
      "%" + entity + "%", "%" + entity + "%", limit);
  }
}
