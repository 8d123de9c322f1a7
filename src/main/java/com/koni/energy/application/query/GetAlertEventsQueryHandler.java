package com.koni.energy.application.query;

import com.koni.energy.domain.exception.ValidationException;
import com.koni.energy.domain.repository.AlertEventRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Query handler for the alert event log.
 *
 * Events are returned newest first. The limit must lie between 1 and
 * {@link GetAlertEventsQuery#MAX_LIMIT}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class GetAlertEventsQueryHandler {

    private final AlertEventRepository alertEventRepository;

    @Transactional(readOnly = true)
    public List<AlertEventResponse> handle(GetAlertEventsQuery query) {
        if (query.getLimit() < 1 || query.getLimit() > GetAlertEventsQuery.MAX_LIMIT) {
            throw new ValidationException("limit must be between 1 and " + GetAlertEventsQuery.MAX_LIMIT);
        }

        List<AlertEventResponse> events = alertEventRepository.findRecent(
                        query.getOwnerId(), query.getDeviceId(), query.getRuleId(), query.getLimit())
                .stream()
                .map(AlertEventResponse::from)
                .collect(Collectors.toList());

        log.debug("Retrieved {} alert events: ownerId={}, deviceId={}, ruleId={}",
                events.size(), query.getOwnerId(), query.getDeviceId(), query.getRuleId());
        return events;
    }
}
