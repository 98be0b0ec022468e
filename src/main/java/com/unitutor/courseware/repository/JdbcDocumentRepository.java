package com.unitutor.courseware.repository;

import com.unitutor.courseware.exception.DocumentNotFoundException;
import com.unitutor.courseware.model.Document;
import com.unitutor.courseware.model.DocumentStatus;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.stereotype.Repository;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;

@Repository
@RequiredArgsConstructor
public class JdbcDocumentRepository implements DocumentRepository {

    private final JdbcClient jdbcClient;

    private final RowMapper<Document> documentRowMapper = (rs, rowNum) -> {
        String statusStr = rs.getString("processing_status");
        DocumentStatus status = (statusStr != null)
            ? DocumentStatus.valueOf(statusStr)
            : DocumentStatus.PENDING;

        return new Document(
            rs.getString("id"),
            rs.getString("filename"),
            rs.getInt("total_pages"),
            rs.getString("file_path"),
            status,
            rs.getInt("processed_pages"),
            rs.getInt("selected_pages"),
            rs.getObject("uploaded_at", OffsetDateTime.class),
            rs.getObject("updated_at", OffsetDateTime.class)
        );
    };

    @Override
    public boolean exists(String id) {
        return jdbcClient.sql("SELECT COUNT(*) FROM pdf_documents WHERE id = :id")
            .param("id", id)
            .query(Integer.class)
            .single() > 0;
    }

    @Override
    public Optional<Document> findById(String id) {
        return jdbcClient.sql("SELECT * FROM pdf_documents WHERE id = :id")
            .param("id", id)
            .query(documentRowMapper)
            .optional();
    }

    @Override
    public Document upsert(String id, String filename, int totalPages, String filePath) {
        String sql = """
            INSERT INTO pdf_documents (id, filename, total_pages, file_path)
            VALUES (:id, :filename, :totalPages, :filePath)
            ON CONFLICT (id) DO UPDATE
            SET filename = EXCLUDED.filename,
                total_pages = EXCLUDED.total_pages,
                file_path = EXCLUDED.file_path,
                processing_status = 'PENDING',
                processed_pages = 0,
                selected_pages = 0,
                updated_at = NOW()
            RETURNING *
            """;

        return jdbcClient.sql(sql)
            .param("id", id)
            .param("filename", filename)
            .param("totalPages", totalPages)
            .param("filePath", filePath)
            .query(documentRowMapper)
            .single();
    }

    @Override
    public void updateStatus(String id, DocumentStatus status, int processedPages) {
        String sql = """
            UPDATE pdf_documents
            SET processing_status = :status,
                processed_pages = :processed,
                updated_at = NOW()
            WHERE id = :id
            """;

        int rowsAffected = jdbcClient.sql(sql)
            .param("status", status.name())
            .param("processed", processedPages)
            .param("id", id)
            .update();

        if (rowsAffected == 0) {
            throw new DocumentNotFoundException(id);
        }
    }

    @Override
    public void updateSelection(String id, int selectedPages) {
        String sql = """
            UPDATE pdf_documents
            SET selected_pages = :selected,
                processed_pages = 0,
                processing_status = 'PROCESSING',
                updated_at = NOW()
            WHERE id = :id
            """;

        int rowsAffected = jdbcClient.sql(sql)
            .param("selected", selectedPages)
            .param("id", id)
            .update();

        if (rowsAffected == 0) {
            throw new DocumentNotFoundException(id);
        }
    }

    @Override
    public void restoreProgress(Document previous) {
        String sql = """
            UPDATE pdf_documents
            SET processing_status = :status,
                processed_pages = :processed,
                selected_pages = :selected,
                updated_at = NOW()
            WHERE id = :id
            """;

        jdbcClient.sql(sql)
            .param("status", previous.status().name())
            .param("processed", previous.processedPages())
            .param("selected", previous.selectedPages())
            .param("id", previous.id())
            .update();
    }

    @Override
    public List<String> findStaleProcessing(int staleThresholdMinutes) {
        String sql = """
            SELECT id
            FROM pdf_documents
            WHERE processing_status = 'PROCESSING'
              AND updated_at < NOW() - (INTERVAL '1 minute' * :staleMins)
            ORDER BY updated_at ASC
            """;

        return jdbcClient.sql(sql)
            .param("staleMins", staleThresholdMinutes)
            .query(String.class)
            .list();
    }

    @Override
    public boolean markFailedIfProcessing(String id, int staleThresholdMinutes) {
        String sql = """
            UPDATE pdf_documents
            SET processing_status = 'FAILED',
                updated_at = NOW()
            WHERE id = :id
              AND processing_status = 'PROCESSING'
              AND updated_at < NOW() - (INTERVAL '1 minute' * :staleMins)
            """;

        return jdbcClient.sql(sql)
            .param("id", id)
            .param("staleMins", staleThresholdMinutes)
            .update() > 0;
    }
}
