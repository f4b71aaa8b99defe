package dev.loom.ragconfig;

import org.springframework.data.jpa.repository.JpaRepository;

/** Spring Data repository for {@link KnowledgeBase} entities. */
public interface KnowledgeBaseRepository extends JpaRepository<KnowledgeBase, String> {}
