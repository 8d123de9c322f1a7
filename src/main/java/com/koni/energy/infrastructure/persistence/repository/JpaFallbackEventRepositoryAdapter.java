package com.koni.energy.infrastructure.persistence.repository;

import com.koni.energy.domain.repository.FallbackEventRepository;
import com.koni.energy.infrastructure.persistence.entity.FallbackEventEntity;
import io.micrometer.observation.annotation.Observed;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.UUID;

/**
 * JPA adapter for FallbackEventRepository.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JpaFallbackEventRepositoryAdapter implements FallbackEventRepository {
    
    private final FallbackEventJpaRepository jpaRepository;
    
    @Override
    @Observed(name = "repository.save", contextualName = "fallback-event-save")
    public void save(FallbackEventEntity event) {
        if (event == null) {
            throw new IllegalArgumentException("FallbackEventEntity cannot be null");
        }
        
        jpaRepository.save(event);
        log.info("Fallback notification saved: eventId={}, deviceId={}", 
            event.getEventId(), event.getDeviceId());
    }
    
    @Override
    @Observed(name = "repository.findAll", contextualName = "fallback-event-findAll")
    public List<FallbackEventEntity> findAll() {
        List<FallbackEventEntity> events = jpaRepository.findAllByOrderByFailedAtAsc();
        log.debug("Retrieved {} fallback notifications", events.size());
        return events;
    }
    
    @Override
    @Observed(name = "repository.delete", contextualName = "fallback-event-delete")
    public void delete(UUID eventId) {
        if (eventId == null) {
            throw new IllegalArgumentException("EventId cannot be null");
        }
        
        jpaRepository.deleteById(eventId);
        log.debug("Fallback notification deleted: eventId={}", eventId);
    }
}
