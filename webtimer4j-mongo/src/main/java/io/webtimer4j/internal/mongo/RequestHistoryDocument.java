package io.webtimer4j.internal.mongo;

import io.webtimer4j.core.HttpMethod;
import io.webtimer4j.history.HistoryRecord;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Mongo document model for one request attempt. {@code _id} is the record sequence.
 */
@Document(collection = "request_history")
public class RequestHistoryDocument {

    @Id
    private Long sequence;

    private String scheduleId;
    private String scheduleName;
    private String requestId;
    private Instant timestamp;
    private String url;
    private HttpMethod method;
    private boolean success;
    private Integer statusCode;
    private Long responseTimeMs;
    private int attempt;
    private String errorMessage;
    private String responseBody;
    private String responseHash;

    public RequestHistoryDocument() {
    }

    static RequestHistoryDocument from(HistoryRecord r) {
        RequestHistoryDocument doc = new RequestHistoryDocument();
        doc.sequence = r.sequence();
        doc.scheduleId = r.scheduleId();
        doc.scheduleName = r.scheduleName();
        doc.requestId = r.requestId();
        doc.timestamp = r.timestamp();
        doc.url = r.url();
        doc.method = r.method();
        doc.success = r.success();
        doc.statusCode = r.statusCode();
        doc.responseTimeMs = r.responseTimeMs();
        doc.attempt = r.attempt();
        doc.errorMessage = r.errorMessage();
        doc.responseBody = r.responseBody();
        doc.responseHash = r.responseHash();
        return doc;
    }

    HistoryRecord toRecord() {
        return new HistoryRecord(sequence, scheduleId, scheduleName, requestId, timestamp, url, method, success,
                statusCode, responseTimeMs, attempt, errorMessage, responseBody, responseHash);
    }

    public Long getSequence() {
        return sequence;
    }

    public void setSequence(Long sequence) {
        this.sequence = sequence;
    }

    public String getScheduleId() {
        return scheduleId;
    }

    public void setScheduleId(String scheduleId) {
        this.scheduleId = scheduleId;
    }

    public String getScheduleName() {
        return scheduleName;
    }

    public void setScheduleName(String scheduleName) {
        this.scheduleName = scheduleName;
    }

    public String getRequestId() {
        return requestId;
    }

    public void setRequestId(String requestId) {
        this.requestId = requestId;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public void setTimestamp(Instant timestamp) {
        this.timestamp = timestamp;
    }

    public String getUrl() {
        return url;
    }

    public void setUrl(String url) {
        this.url = url;
    }

    public HttpMethod getMethod() {
        return method;
    }

    public void setMethod(HttpMethod method) {
        this.method = method;
    }

    public boolean isSuccess() {
        return success;
    }

    public void setSuccess(boolean success) {
        this.success = success;
    }

    public Integer getStatusCode() {
        return statusCode;
    }

    public void setStatusCode(Integer statusCode) {
        this.statusCode = statusCode;
    }

    public Long getResponseTimeMs() {
        return responseTimeMs;
    }

    public void setResponseTimeMs(Long responseTimeMs) {
        this.responseTimeMs = responseTimeMs;
    }

    public int getAttempt() {
        return attempt;
    }

    public void setAttempt(int attempt) {
        this.attempt = attempt;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public void setErrorMessage(String errorMessage) {
        this.errorMessage = errorMessage;
    }

    public String getResponseBody() {
        return responseBody;
    }

    public void setResponseBody(String responseBody) {
        this.responseBody = responseBody;
    }

    public String getResponseHash() {
        return responseHash;
    }

    public void setResponseHash(String responseHash) {
        this.responseHash = responseHash;
    }
}
