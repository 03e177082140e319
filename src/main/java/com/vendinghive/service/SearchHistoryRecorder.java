package com.vendinghive.service;

import com.vendinghive.entity.SearchHistory;
import com.vendinghive.exception.SearchHistoryPersistenceException;
import com.vendinghive.repository.SearchHistoryRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * 검색 이력 + 순위별 결과를 한 트랜잭션으로 저장
 */
@Slf4j
@Service
public class SearchHistoryRecorder {

    private final SearchHistoryRepository searchHistoryRepository;
    private final TransactionTemplate transactionTemplate;

    public SearchHistoryRecorder(SearchHistoryRepository searchHistoryRepository,
                                 PlatformTransactionManager transactionManager) {
        this.searchHistoryRepository = searchHistoryRepository;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    /**
     * @throws SearchHistoryPersistenceException 저장 실패 (호출 측은 결과를 그대로 반환하고 경고만 남김)
     */
    public SearchHistory record(SearchHistory history) {
        try {
            SearchHistory saved = transactionTemplate.execute(status -> searchHistoryRepository.saveAndFlush(history));
            log.info("[SearchHistoryRecorder] recorded search {} for operator {} ({} results)",
                    saved.getId(), saved.getOperatorId(), saved.getResultCount());
            return saved;
        } catch (DataAccessException | TransactionException e) {
            log.error("[SearchHistoryRecorder] failed to record search for operator {}: {}",
                    history.getOperatorId(), e.getMessage(), e);
            throw new SearchHistoryPersistenceException("Failed to record search history", e);
        }
    }
}
