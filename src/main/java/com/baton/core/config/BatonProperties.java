package com.baton.core.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
@ConfigurationProperties(prefix = "baton")
public class BatonProperties {

    /** Actor name the engine posts under; events from this actor are ignored. */
    private String engineActor = "baton";

    private Store store = new Store();
    private Checkpoint checkpoint = new Checkpoint();
    private ReviewCycle reviewCycle = new ReviewCycle();
    private Broadcast broadcast = new Broadcast();
    private Api api = new Api();

    public String getEngineActor() {
        return engineActor;
    }

    public void setEngineActor(String engineActor) {
        this.engineActor = engineActor;
    }

    public Store getStore() {
        return store;
    }

    public void setStore(Store store) {
        this.store = store;
    }

    public Checkpoint getCheckpoint() {
        return checkpoint;
    }

    public void setCheckpoint(Checkpoint checkpoint) {
        this.checkpoint = checkpoint;
    }

    public ReviewCycle getReviewCycle() {
        return reviewCycle;
    }

    public void setReviewCycle(ReviewCycle reviewCycle) {
        this.reviewCycle = reviewCycle;
    }

    public Broadcast getBroadcast() {
        return broadcast;
    }

    public void setBroadcast(Broadcast broadcast) {
        this.broadcast = broadcast;
    }

    public Api getApi() {
        return api;
    }

    public void setApi(Api api) {
        this.api = api;
    }

    public static class Store {
        private int maxWriteAttempts = 5;

        public int getMaxWriteAttempts() {
            return maxWriteAttempts;
        }

        public void setMaxWriteAttempts(int maxWriteAttempts) {
            this.maxWriteAttempts = maxWriteAttempts;
        }
    }

    public static class Checkpoint {
        private List<String> placeholderActions = List.of(
                "continue", "continue working", "keep working", "work on it", "next steps",
                "tbd", "todo", "n/a", "none", "-", "...", "same as before", "finish");

        public List<String> getPlaceholderActions() {
            return placeholderActions;
        }

        public void setPlaceholderActions(List<String> placeholderActions) {
            this.placeholderActions = placeholderActions;
        }
    }

    public static class ReviewCycle {
        private int patternNoteCycle = 3;
        private int escalationCycle = 4;

        public int getPatternNoteCycle() {
            return patternNoteCycle;
        }

        public void setPatternNoteCycle(int patternNoteCycle) {
            this.patternNoteCycle = patternNoteCycle;
        }

        public int getEscalationCycle() {
            return escalationCycle;
        }

        public void setEscalationCycle(int escalationCycle) {
            this.escalationCycle = escalationCycle;
        }
    }

    public static class Broadcast {
        private boolean epicOnBlock = true;

        public boolean isEpicOnBlock() {
            return epicOnBlock;
        }

        public void setEpicOnBlock(boolean epicOnBlock) {
            this.epicOnBlock = epicOnBlock;
        }
    }

    public static class Api {
        private String baseUrl = "http://localhost:8080";

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }
    }
}
