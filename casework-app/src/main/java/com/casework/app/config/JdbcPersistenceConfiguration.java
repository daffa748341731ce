package com.casework.app.config;

import com.casework.engine.persistence.jdbc.JdbcAttachmentRepository;
import com.casework.engine.persistence.jdbc.JdbcCaseRecordRepository;
import com.casework.engine.persistence.jdbc.JdbcCommentRepository;
import com.casework.engine.persistence.jdbc.JdbcRevisionRepository;
import com.casework.engine.persistence.jdbc.JdbcTransitionHistoryRepository;
import com.casework.engine.persistence.jdbc.JdbcUnitOfWork;
import com.casework.engine.persistence.jdbc.JdbcWorkflowRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.PlatformTransactionManager;

/**
 * PostgreSQL repositories over the Boot-managed data source.
 */
@Configuration
@ConditionalOnProperty(name = "casework.persistence", havingValue = "jdbc", matchIfMissing = true)
public class JdbcPersistenceConfiguration {

    @Bean
    public JdbcWorkflowRepository workflowRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        return new JdbcWorkflowRepository(jdbcTemplate, objectMapper);
    }

    @Bean
    public JdbcCaseRecordRepository caseRecordRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        return new JdbcCaseRecordRepository(jdbcTemplate, objectMapper);
    }

    @Bean
    public JdbcTransitionHistoryRepository transitionHistoryRepository(JdbcTemplate jdbcTemplate) {
        return new JdbcTransitionHistoryRepository(jdbcTemplate);
    }

    @Bean
    public JdbcRevisionRepository revisionRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        return new JdbcRevisionRepository(jdbcTemplate, objectMapper);
    }

    @Bean
    public JdbcCommentRepository commentRepository(JdbcTemplate jdbcTemplate) {
        return new JdbcCommentRepository(jdbcTemplate);
    }

    @Bean
    public JdbcAttachmentRepository attachmentRepository(JdbcTemplate jdbcTemplate) {
        return new JdbcAttachmentRepository(jdbcTemplate);
    }

    @Bean
    public JdbcUnitOfWork unitOfWork(PlatformTransactionManager transactionManager) {
        return new JdbcUnitOfWork(transactionManager);
    }
}
