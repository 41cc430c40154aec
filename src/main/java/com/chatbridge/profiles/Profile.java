package com.chatbridge.profiles;

import com.chatbridge.shared.model.MediaTicket;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Aggregate state of one conversation, keyed by canonical chat id. Instances are mutable and
 * owned by {@link ProfileStore}; everything handed out of the store is a copy.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class Profile {

    @JsonProperty("chat_id")
    private String chatId;
    @JsonProperty("name")
    private String name;
    @JsonProperty("lang")
    private String language;
    @JsonProperty("tier")
    private String tier;
    @JsonProperty("tags")
    private Map<String, String> tags = new LinkedHashMap<>();
    @JsonProperty("first_seen")
    private Instant firstSeen;
    @JsonProperty("last_conn")
    private Instant lastConnection;
    @JsonProperty("last_chat")
    private String lastChat;
    @JsonProperty("last_text")
    private String lastText;
    @JsonProperty("media")
    private MediaHistory media = new MediaHistory();
    @JsonProperty("block")
    private Block block = new Block();
    @JsonProperty("metrics")
    private Metrics metrics = new Metrics();

    public static Profile fresh(String chatId, Instant now) {
        var p = new Profile();
        p.chatId = chatId;
        p.language = "es";
        p.tier = "free";
        p.firstSeen = now;
        p.lastConnection = now;
        return p;
    }

    public static class MediaHistory {
        @JsonProperty("in")
        private List<MediaTicket> in = new ArrayList<>();
        @JsonProperty("out")
        private List<MediaTicket> out = new ArrayList<>();

        public List<MediaTicket> in() { return in; }
        public List<MediaTicket> out() { return out; }
    }

    public static class Block {
        @JsonProperty("spam")
        private boolean spam;
        @JsonProperty("malicious")
        private boolean malicious;
        @JsonProperty("permanent")
        private boolean permanent;
        @JsonProperty("until")
        private Instant until;

        public boolean spam() { return spam; }
        public boolean malicious() { return malicious; }
        public boolean permanent() { return permanent; }
        public Instant until() { return until; }
    }

    public static class Metrics {
        @JsonProperty("msg_in")
        private int msgIn;
        @JsonProperty("msg_out")
        private int msgOut;
        @JsonProperty("last_msg_at")
        private Instant lastMsgAt;
        @JsonProperty("last_msg_id")
        private String lastMsgId;
        @JsonProperty("streak_days")
        private int streakDays;
        @JsonProperty("streak_last_day")
        private String streakLastDay;

        public int msgIn() { return msgIn; }
        public int msgOut() { return msgOut; }
        public Instant lastMsgAt() { return lastMsgAt; }
        public String lastMsgId() { return lastMsgId; }
        public int streakDays() { return streakDays; }
        public String streakLastDay() { return streakLastDay; }

        void recordInbound(String messageId, Instant at) {
            msgIn++;
            lastMsgAt = at;
            lastMsgId = messageId;
        }

        void recordOutbound(Instant at) {
            msgOut++;
            lastMsgAt = at;
        }

        void streak(int days, String lastDay) {
            this.streakDays = days;
            this.streakLastDay = lastDay;
        }
    }

    public String chatId() { return chatId; }
    public String name() { return name; }
    public String language() { return language; }
    public String tier() { return tier; }
    public Map<String, String> tags() { return tags; }
    public Instant firstSeen() { return firstSeen; }
    public Instant lastConnection() { return lastConnection; }
    public String lastChat() { return lastChat; }
    public String lastText() { return lastText; }
    public MediaHistory media() { return media; }
    public Block block() { return block; }
    public Metrics metrics() { return metrics; }

    void name(String name) { this.name = name; }

    void touch(Instant at, String chat, String text) {
        this.lastConnection = at;
        this.lastChat = chat;
        this.lastText = text;
    }
}
