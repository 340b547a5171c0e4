package com.github.spud.sample.ai.agentic.tools.builtin;

import java.util.List;
import java.util.Optional;

/**
 * 文档与知识图谱查询协作方
 */
public interface DocumentLookup {

  Optional<ParentDocument> findByTitle(String titleFragment);

  Optional<ParentDocument> findById(String documentId);

  List<EntityRelation> findRelationships(String entity, int limit);

  record ParentDocument(String documentId, String title, String summary, String fullText) {

  }

  record EntityRelation(String source, String relationship, String target) {

  }
}
