package com.aiwriter.schedule.store.service;

import com.aiwriter.schedule.core.model.ChangeKind;
import com.aiwriter.schedule.core.model.LocalSchedule;
import com.aiwriter.schedule.core.model.ScheduledContentRecord;
import com.aiwriter.schedule.store.api.ScheduledContentRequest;
import com.aiwriter.schedule.store.r2dbc.ChangeLogStore;
import com.aiwriter.schedule.store.r2dbc.ScheduledContentStore;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.reactive.TransactionalOperator;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.UUID;

/**
 * Creates scheduled content.
 *
 * The record row and its change-log row are written in one transaction, so the change
 * feed carries exactly the records that were committed. Publishing happens later, outside
 * the transaction; see ChangeFeedRelay.
 */
@Service
public class ContentStoreService {

    private static final Logger log = LoggerFactory.getLogger(ContentStoreService.class);

    private final ScheduledContentStore contents;
    private final ChangeLogStore changeLog;
    private final TransactionalOperator tx;
    private final ObjectMapper mapper;
    private final Clock clock;

    public ContentStoreService(ScheduledContentStore contents, ChangeLogStore changeLog, TransactionalOperator tx,
                               ObjectMapper mapper, Clock clock) {
        this.contents = contents;
        this.changeLog = changeLog;
        this.tx = tx;
        this.mapper = mapper;
        this.clock = clock;
    }

    /**
     * @throws IllegalArgumentException (as a Mono error) if the schedule is not a real calendar date/time
     */
    public Mono<ScheduledContentRecord> create(ScheduledContentRequest req) {
        return Mono.fromCallable(() -> toRecord(req))
                .flatMap(record -> {
                    String rowImage;
                    String scheduleJson;
                    try {
                        rowImage = mapper.writeValueAsString(record);
                        scheduleJson = mapper.writeValueAsString(record.schedule());
                    } catch (JsonProcessingException e) {
                        return Mono.<ScheduledContentRecord>error(new IllegalStateException("record not serializable id=" + record.id(), e));
                    }
                    return contents.insert(record, scheduleJson)
                            .then(changeLog.insertPending(ChangeKind.INSERT, record.entity(), rowImage))
                            .as(tx::transactional)
                            .doOnNext(changeId -> log.info("Stored scheduled content recordId={} changeId={} schedule={}",
                                    record.id(), changeId, record.schedule()))
                            .thenReturn(record);
                });
    }

    ScheduledContentRecord toRecord(ScheduledContentRequest req) {
        ScheduledContentRequest.Schedule s = req.schedule();
        LocalSchedule schedule = new LocalSchedule(s.year(), s.month(), s.day(), s.hour(), s.minute(), s.second());
        return new ScheduledContentRecord(
                UUID.randomUUID().toString(),
                req.userId(),
                blankToNull(req.draftId()),
                blankToNull(req.articleId()),
                ScheduledContentRecord.ENTITY_TAG,
                schedule,
                clock.millis()
        );
    }

    private static String blankToNull(String v) {
        return v == null || v.isBlank() ? null : v;
    }
}
