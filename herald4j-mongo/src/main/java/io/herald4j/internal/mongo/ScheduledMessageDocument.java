package io.herald4j.internal.mongo;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.data.mongodb.core.mapping.Field;

import java.util.ArrayList;
import java.util.List;

/**
 * Mongo document model for persisted scheduled messages.
 */
@Document(collection = ScheduledMessageDocument.COLLECTION)
public class ScheduledMessageDocument {

    public static final String COLLECTION = "scheduled_messages";

    @Id
    private String id;

    private String destination;

    @Field("schedule_name")
    private String scheduleName;

    private String body;

    @Field("media_type")
    private String mediaType;

    @Field("media_ref")
    private String mediaRef;

    @Field("media_access_token")
    private String mediaAccessToken;

    private List<Button> buttons = new ArrayList<>();

    // Any BSON value; validated on recovery.
    @Field("interval_seconds")
    private Object intervalSeconds;

    @Field("fire_at")
    private String fireAt;

    private boolean completed;

    public ScheduledMessageDocument() {
    }

    public static class Button {
        private String text;
        private String url;

        public Button() {
        }

        public Button(String text, String url) {
            this.text = text;
            this.url = url;
        }

        public String getText() {
            return text;
        }

        public void setText(String text) {
            this.text = text;
        }

        public String getUrl() {
            return url;
        }

        public void setUrl(String url) {
            this.url = url;
        }
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getDestination() {
        return destination;
    }

    public void setDestination(String destination) {
        this.destination = destination;
    }

    public String getScheduleName() {
        return scheduleName;
    }

    public void setScheduleName(String scheduleName) {
        this.scheduleName = scheduleName;
    }

    public String getBody() {
        return body;
    }

    public void setBody(String body) {
        this.body = body;
    }

    public String getMediaType() {
        return mediaType;
    }

    public void setMediaType(String mediaType) {
        this.mediaType = mediaType;
    }

    public String getMediaRef() {
        return mediaRef;
    }

    public void setMediaRef(String mediaRef) {
        this.mediaRef = mediaRef;
    }

    public String getMediaAccessToken() {
        return mediaAccessToken;
    }

    public void setMediaAccessToken(String mediaAccessToken) {
        this.mediaAccessToken = mediaAccessToken;
    }

    public List<Button> getButtons() {
        return buttons;
    }

    public void setButtons(List<Button> buttons) {
        this.buttons = buttons;
    }

    public Object getIntervalSeconds() {
        return intervalSeconds;
    }

    public void setIntervalSeconds(Object intervalSeconds) {
        this.intervalSeconds = intervalSeconds;
    }

    public String getFireAt() {
        return fireAt;
    }

    public void setFireAt(String fireAt) {
        this.fireAt = fireAt;
    }

    public boolean isCompleted() {
        return completed;
    }

    public void setCompleted(boolean completed) {
        this.completed = completed;
    }
}
