package com.demoBank.chatbox.storage;

import com.demoBank.chatbox.common.util.UserIdMasker;
import com.demoBank.chatbox.config.ChatboxProperties;
import com.demoBank.chatbox.session.SessionMessage;
import com.demoBank.chatbox.session.SessionSummary;
import lombok.extern.slf4j.Slf4j;
import org.bson.Document;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Date;
import java.util.List;
import java.util.function.Supplier;

/**
 * MongoDB implementation of {@link SessionStore}.
 * 
 * Sessions live in one collection keyed by session ID, messages in another keyed by message ID.
 * All writes are upserts, so replaying a write is harmless.
 */
@Slf4j
@Repository
public class MongoSessionStore implements SessionStore {
    
    private final MongoTemplate mongoTemplate;
    private final String sessionsCollection;
    private final String messagesCollection;
    
    public MongoSessionStore(MongoTemplate mongoTemplate, ChatboxProperties properties) {
        this.mongoTemplate = mongoTemplate;
        this.sessionsCollection = properties.getStorage().getSessionsCollection();
        this.messagesCollection = properties.getStorage().getMessagesCollection();
    }
    
    @Override
    public void createSession(SessionSummary session) {
        Update update = new Update()
                .setOnInsert("user_id", session.getUserId())
                .setOnInsert("start_time", toDate(session.getStartTime()))
                .set("is_active", session.isActive())
                .set("last_activity", toDate(session.getLastActivity()));
        execute("create session", () -> mongoTemplate.upsert(byId(session.getSessionId()), update, sessionsCollection));
        log.debug("Session stored - sessionId: {}, userId: {}", session.getSessionId(), UserIdMasker.mask(session.getUserId()));
    }
    
    @Override
    public void updateSession(SessionSummary session) {
        Document fields = new Document()
                .append("name", session.getName())
                .append("model_id", session.getModelId())
                .append("message_count", session.getMessageCount())
                .append("last_activity", toDate(session.getLastActivity()))
                .append("is_active", session.isActive())
                .append("help_requested", session.isHelpRequested())
                .append("admin_assisted", session.isAdminAssisted())
                .append("assisting_admin_id", session.getAssistingAdminId())
                .append("assisting_admin_name", session.getAssistingAdminName())
                .append("total_tokens", session.getTotalTokens())
                .append("avg_response_time_ms", session.getAverageResponseTimeMs())
                .append("max_response_time_ms", session.getMaxResponseTimeMs());
        Update update = Update.fromDocument(new Document("$set", fields))
                .setOnInsert("user_id", session.getUserId())
                .setOnInsert("start_time", toDate(session.getStartTime()));
        execute("update session", () -> mongoTemplate.upsert(byId(session.getSessionId()), update, sessionsCollection));
    }
    
    @Override
    public void recordMessage(String sessionId, SessionMessage message) {
        Update update = new Update()
                .setOnInsert("session_id", sessionId)
                .setOnInsert("content", message.getContent())
                .setOnInsert("sender", message.getSender() != null ? message.getSender().getValue() : null)
                .setOnInsert("timestamp", toDate(message.getTimestamp()))
                .setOnInsert("file_id", message.getFileId())
                .setOnInsert("file_url", message.getFileUrl())
                .setOnInsert("metadata", message.getMetadata() != null ? new Document(message.getMetadata()) : null);
        execute("record message", () -> mongoTemplate.upsert(byId(message.getId()), update, messagesCollection));
    }
    
    @Override
    public void endSession(String sessionId, Instant endTime) {
        // only the first end is kept
        Query query = new Query(Criteria.where("_id").is(sessionId).and("end_time").exists(false));
        Update update = new Update()
                .set("end_time", toDate(endTime))
                .set("is_active", false);
        execute("end session", () -> mongoTemplate.updateFirst(query, update, sessionsCollection));
    }
    
    @Override
    public List<SessionSummary> listSessionsByUser(String userId, int limit) {
        Query query = new Query(Criteria.where("user_id").is(userId))
                .with(Sort.by(Sort.Direction.DESC, "start_time"))
                .limit(limit);
        List<Document> documents = execute("list sessions", 
                () -> mongoTemplate.find(query, Document.class, sessionsCollection));
        return documents.stream().map(this::toSummary).toList();
    }
    
    @Override
    public SessionMetrics aggregateMetrics(Instant start, Instant end) {
        Query query = new Query(Criteria.where("start_time").gte(toDate(start)).lte(toDate(end)));
        query.fields().include("end_time", "admin_assisted", "total_tokens", "avg_response_time_ms", "max_response_time_ms");
        List<Document> documents = execute("aggregate metrics",
                () -> mongoTemplate.find(query, Document.class, sessionsCollection));
        
        long active = 0;
        long adminAssisted = 0;
        long tokens = 0;
        long maxResponse = 0;
        long responseSum = 0;
        long responseSamples = 0;
        for (Document document : documents) {
            if (document.get("end_time") == null) {
                active++;
            }
            if (document.getBoolean("admin_assisted", false)) {
                adminAssisted++;
            }
            tokens += longValue(document, "total_tokens");
            maxResponse = Math.max(maxResponse, longValue(document, "max_response_time_ms"));
            long average = longValue(document, "avg_response_time_ms");
            if (average > 0) {
                responseSum += average;
                responseSamples++;
            }
        }
        return SessionMetrics.builder()
                .totalSessions(documents.size())
                .activeSessions(active)
                .adminAssistedCount(adminAssisted)
                .totalTokens(tokens)
                .maxResponseTimeMs(maxResponse)
                .avgResponseTimeMs(responseSamples == 0 ? 0 : responseSum / responseSamples)
                .build();
    }
    
    @Override
    public void ping() {
        execute("ping database", () -> mongoTemplate.executeCommand(new Document("ping", 1)));
    }
    
    private SessionSummary toSummary(Document document) {
        return SessionSummary.builder()
                .sessionId(document.getString("_id"))
                .userId(document.getString("user_id"))
                .name(document.getString("name"))
                .modelId(document.getString("model_id"))
                .messageCount(document.get("message_count", 0))
                .startTime(toInstant(document.getDate("start_time")))
                .lastActivity(toInstant(document.getDate("last_activity")))
                .endTime(toInstant(document.getDate("end_time")))
                .active(document.getBoolean("is_active", false))
                .helpRequested(document.getBoolean("help_requested", false))
                .adminAssisted(document.getBoolean("admin_assisted", false))
                .assistingAdminId(document.getString("assisting_admin_id"))
                .assistingAdminName(document.getString("assisting_admin_name"))
                .totalTokens(document.get("total_tokens", 0L))
                .averageResponseTimeMs(document.get("avg_response_time_ms", 0L))
                .maxResponseTimeMs(document.get("max_response_time_ms", 0L))
                .build();
    }
    
    private <T> T execute(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (DataAccessException e) {
            boolean transientFailure = e instanceof TransientDataAccessException;
            log.error("Storage operation failed - operation: {}, transient: {}", operation, transientFailure, e);
            throw new StorageException("Failed to " + operation, transientFailure, e);
        }
    }
    
    // numbers may come back as int or long depending on the writer
    private static long longValue(Document document, String field) {
        Object value = document.get(field);
        return value instanceof Number ? ((Number) value).longValue() : 0L;
    }
    
    private static Query byId(String id) {
        return new Query(Criteria.where("_id").is(id));
    }
    
    private static Date toDate(Instant instant) {
        return instant == null ? null : Date.from(instant);
    }
    
    private static Instant toInstant(Date date) {
        return date == null ? null : date.toInstant();
    }
}
