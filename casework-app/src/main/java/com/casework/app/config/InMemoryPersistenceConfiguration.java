package com.casework.app.config;

import com.casework.engine.persistence.InMemoryAttachmentRepository;
import com.casework.engine.persistence.InMemoryCaseRecordRepository;
import com.casework.engine.persistence.InMemoryCommentRepository;
import com.casework.engine.persistence.InMemoryRevisionRepository;
import com.casework.engine.persistence.InMemoryTransitionHistoryRepository;
import com.casework.engine.persistence.InMemoryUnitOfWork;
import com.casework.engine.persistence.InMemoryWorkflowRepository;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Process-local repositories. State is lost on restart.
 */
@Configuration
@ConditionalOnProperty(name = "casework.persistence", havingValue = "memory")
public class InMemoryPersistenceConfiguration {

    @Bean
    public InMemoryWorkflowRepository workflowRepository() {
        return new InMemoryWorkflowRepository();
    }

    @Bean
    public InMemoryCaseRecordRepository caseRecordRepository() {
        return new InMemoryCaseRecordRepository();
    }

    @Bean
    public InMemoryTransitionHistoryRepository transitionHistoryRepository() {
        return new InMemoryTransitionHistoryRepository();
    }

    @Bean
    public InMemoryRevisionRepository revisionRepository() {
        return new InMemoryRevisionRepository();
    }

    @Bean
    public InMemoryCommentRepository commentRepository() {
        return new InMemoryCommentRepository();
    }

    @Bean
    public InMemoryAttachmentRepository attachmentRepository() {
        return new InMemoryAttachmentRepository();
    }

    @Bean
    public InMemoryUnitOfWork unitOfWork() {
        return new InMemoryUnitOfWork();
    }
}
