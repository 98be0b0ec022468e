package com.unitutor.courseware.repository;

import com.unitutor.courseware.model.PageArtifact;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.stereotype.Repository;

import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
@RequiredArgsConstructor
public class JdbcPageArtifactRepository implements PageArtifactRepository {

    private final JdbcClient jdbcClient;

    private final RowMapper<PageArtifact> artifactRowMapper = (rs, rowNum) -> new PageArtifact(
        rs.getString("pdf_id"),
        rs.getInt("page_number"),
        rs.getString("page_type"),
        rs.getString("explanation"),
        rs.getString("summary"),
        rs.getObject("created_at", OffsetDateTime.class)
    );

    @Override
    public Optional<PageArtifact> find(String documentId, int pageNumber) {
        return jdbcClient.sql("SELECT * FROM page_explanations WHERE pdf_id = :docId AND page_number = :page")
            .param("docId", documentId)
            .param("page", pageNumber)
            .query(artifactRowMapper)
            .optional();
    }

    @Override
    public List<String> findSummariesBefore(String documentId, int beforePage, int limit) {
        if (limit <= 0 || beforePage <= 1) {
            return List.of();
        }

        String sql = """
            SELECT summary
            FROM page_explanations
            WHERE pdf_id = :docId
              AND page_number >= :fromPage
              AND page_number < :beforePage
              AND summary IS NOT NULL
            ORDER BY page_number ASC
            """;

        return jdbcClient.sql(sql)
            .param("docId", documentId)
            .param("fromPage", Math.max(1, beforePage - limit))
            .param("beforePage", beforePage)
            .query(String.class)
            .list();
    }

    @Override
    public PageArtifact save(String documentId, int pageNumber, String pageType, String body, String summary) {
        String sql = """
            INSERT INTO page_explanations (pdf_id, page_number, page_type, explanation, summary)
            VALUES (:docId, :page, :pageType, :body, :summary)
            ON CONFLICT (pdf_id, page_number) DO UPDATE
            SET page_type = EXCLUDED.page_type,
                explanation = EXCLUDED.explanation,
                summary = EXCLUDED.summary,
                created_at = NOW()
            RETURNING *
            """;

        return jdbcClient.sql(sql)
            .param("docId", documentId)
            .param("page", pageNumber)
            .param("pageType", pageType != null ? pageType : PageArtifact.DEFAULT_PAGE_TYPE)
            .param("body", body)
            .param("summary", summary)
            .query(artifactRowMapper)
            .single();
    }

    @Override
    public List<PageArtifact> findAll(String documentId) {
        return jdbcClient.sql("SELECT * FROM page_explanations WHERE pdf_id = :docId ORDER BY page_number ASC")
            .param("docId", documentId)
            .query(artifactRowMapper)
            .list();
    }

    @Override
    public int countByDocument(String documentId) {
        return jdbcClient.sql("SELECT COUNT(*) FROM page_explanations WHERE pdf_id = :docId")
            .param("docId", documentId)
            .query(Integer.class)
            .single();
    }

    @Override
    public int delete(String documentId, Collection<Integer> pageNumbers) {
        if (pageNumbers == null || pageNumbers.isEmpty()) {
            return 0;
        }

        return jdbcClient.sql("DELETE FROM page_explanations WHERE pdf_id = :docId AND page_number IN (:pages)")
            .param("docId", documentId)
            .param("pages", pageNumbers)
            .update();
    }
}
