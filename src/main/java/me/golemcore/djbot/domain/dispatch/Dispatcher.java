package me.golemcore.djbot.domain.dispatch;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import me.golemcore.djbot.domain.approval.SongApprovalGate;
import me.golemcore.djbot.domain.approval.TrackFormatter;
import me.golemcore.djbot.domain.approval.UserApprovalService;
import me.golemcore.djbot.domain.dispatch.PlaylistMutationService.PriorityPlacement;
import me.golemcore.djbot.domain.model.ApprovalOutcome;
import me.golemcore.djbot.domain.model.ApprovalSource;
import me.golemcore.djbot.domain.model.ChatMessage;
import me.golemcore.djbot.domain.model.InboundChatMessageEvent;
import me.golemcore.djbot.domain.model.InputMessage;
import me.golemcore.djbot.domain.model.MessageContext;
import me.golemcore.djbot.domain.model.MessageState;
import me.golemcore.djbot.domain.model.MessageType;
import me.golemcore.djbot.domain.model.RankedCandidate;
import me.golemcore.djbot.domain.model.Reaction;
import me.golemcore.djbot.domain.model.Track;
import me.golemcore.djbot.domain.service.DedupStore;
import me.golemcore.djbot.infrastructure.config.BotProperties;
import me.golemcore.djbot.infrastructure.i18n.MessageService;
import me.golemcore.djbot.port.outbound.CatalogException;
import me.golemcore.djbot.port.outbound.CatalogPort;
import me.golemcore.djbot.port.outbound.ChatFrontendPort;
import me.golemcore.djbot.port.outbound.RankingPort;
import me.golemcore.djbot.ratelimit.FloodGate;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.regex.Pattern;

/**
 * Per-message state machine that turns chat messages into playlist additions.
 *
 * <p>
 * Every admitted message gets its own {@link MessageContext} and runs on the
 * message executor. Routing:
 * <ul>
 * <li>Spotify link: extract the id, check for a duplicate, add</li>
 * <li>other link: ask which song was meant</li>
 * <li>free text: drop chatter, disambiguate, confirm with the sender, add</li>
 * </ul>
 * Additions go through the approval gate when it is enabled. Domain failures
 * end in exactly one localized reply; the context is always unregistered.
 *
 * @since 1.0
 */
@Service
@Slf4j
public class Dispatcher {

    private static final Pattern SPOTIFY_LINK = Pattern.compile(
            "(?i)^(spotify:|https?://(open|play)\\.spotify\\.com/|https?://spotify\\.link/)");
    private static final Pattern CHATTER = Pattern.compile(
            "(?i)\\b(hello|hi|hey|good (morning|afternoon|evening|night)|how are you|what'?s up|weather"
                    + "|lunch|dinner|work|tired|busy|weekend|holiday|birthday|thanks|thank you|lol|haha"
                    + "|see you|bye|goodbye|later)\\b");
    private static final int MIN_REQUEST_LENGTH = 3;
    private static final String UNKNOWN = "Unknown";

    private final ChatFrontendPort frontend;
    private final CatalogPort catalogPort;
    private final RankingPort rankingPort;
    private final DedupStore dedupStore;
    private final FloodGate floodGate;
    private final TrackDisambiguator disambiguator;
    private final PlaylistMutationService mutationService;
    private final UserApprovalService userApprovalService;
    private final SongApprovalGate approvalGate;
    private final BotProperties properties;
    private final MessageService messageService;
    private final Clock clock;

    private final Map<String, MessageContext> contexts = new ConcurrentHashMap<>();
    private final ExecutorService ownExecutor;
    private Executor messageExecutor;

    public Dispatcher(ChatFrontendPort frontend, CatalogPort catalogPort, RankingPort rankingPort,
            DedupStore dedupStore, FloodGate floodGate, TrackDisambiguator disambiguator,
            PlaylistMutationService mutationService, UserApprovalService userApprovalService,
            SongApprovalGate approvalGate, BotProperties properties, MessageService messageService, Clock clock) {
        this.frontend = frontend;
        this.catalogPort = catalogPort;
        this.rankingPort = rankingPort;
        this.dedupStore = dedupStore;
        this.floodGate = floodGate;
        this.disambiguator = disambiguator;
        this.mutationService = mutationService;
        this.userApprovalService = userApprovalService;
        this.approvalGate = approvalGate;
        this.properties = properties;
        this.messageService = messageService;
        this.clock = clock;

        AtomicInteger threadCounter = new AtomicInteger();
        this.ownExecutor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "dispatch-" + threadCounter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        this.messageExecutor = ownExecutor;
    }

    void setMessageExecutor(Executor messageExecutor) {
        this.messageExecutor = messageExecutor;
    }

    // ==================== Lifecycle ====================

    @EventListener(ApplicationReadyEvent.class)
    public void start() {
        frontend.start();
        try {
            List<String> snapshot = catalogPort.getPlaylistTrackIds();
            dedupStore.load(snapshot);
            log.info("[Dispatcher] Loaded {} playlist tracks into dedup store", dedupStore.size());
        } catch (CatalogException e) {
            log.warn("[Dispatcher] Failed to load playlist snapshot: {}", e.getMessage());
        }
        sendToGroup("bot.startup");
        log.info("[Dispatcher] Started");
    }

    @PreDestroy
    public void stop() {
        log.info("[Dispatcher] Stopping");
        sendToGroup("bot.shutdown");
        floodGate.stop();

        ownExecutor.shutdown();
        try {
            long drainMs = properties.getApp().getShutdownDrain().toMillis();
            if (!ownExecutor.awaitTermination(drainMs, TimeUnit.MILLISECONDS)) {
                log.warn("[Dispatcher] {} messages still in flight, interrupting", contexts.size());
                ownExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            ownExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        frontend.stop();
    }

    public int getActiveContextCount() {
        return contexts.size();
    }

    List<MessageContext> activeContexts() {
        return List.copyOf(contexts.values());
    }

    // ==================== Intake ====================

    @EventListener
    public void onInboundMessage(InboundChatMessageEvent event) {
        handleMessage(event.message());
    }

    public void handleMessage(ChatMessage message) {
        if (!floodGate.checkMessage(message.getChatId(), message.getSenderId())) {
            log.info("[Dispatcher] Flood limit hit by {} in {}", message.getSenderId(), message.getChatId());
            react(message, Reaction.FLOODED);
            return;
        }

        Instant now = clock.instant();
        InputMessage input = toInput(message, now);
        MessageContext context = MessageContext.builder()
                .input(input)
                .origin(message)
                .startTime(now)
                .timeoutAt(now.plusSeconds(properties.getApp().getConfirmTimeoutSeconds()))
                .build();
        contexts.put(context.key(), context);
        try {
            messageExecutor.execute(() -> processMessage(context));
        } catch (RuntimeException e) {
            contexts.remove(context.key());
            log.warn("[Dispatcher] Rejected message {}: {}", context.key(), e.getMessage());
        }
    }

    static InputMessage toInput(ChatMessage message, Instant receivedAt) {
        List<String> urls = message.getUrls() != null ? message.getUrls() : List.of();
        MessageType type;
        if (urls.stream().anyMatch(Dispatcher::isSpotifyLink)) {
            type = MessageType.SPOTIFY_LINK;
        } else if (!urls.isEmpty()) {
            type = MessageType.NON_SPOTIFY_LINK;
        } else {
            type = MessageType.FREE_TEXT;
        }
        return InputMessage.builder()
                .type(type)
                .text(message.getText())
                .urls(urls)
                .chatId(message.getChatId())
                .senderId(message.getSenderId())
                .messageId(message.getId())
                .timestamp(receivedAt)
                .build();
    }

    static boolean isSpotifyLink(String url) {
        return url != null && SPOTIFY_LINK.matcher(url.trim()).find();
    }

    // ==================== State machine ====================

    void processMessage(MessageContext context) {
        ChatMessage origin = context.getOrigin();
        try {
            log.debug("[Dispatcher] Processing {} ({})", context.key(), context.getInput().getType());
            react(origin, Reaction.PROCESSING);

            switch (context.getInput().getType()) {
            case SPOTIFY_LINK -> handleLink(context);
            case NON_SPOTIFY_LINK -> askWhichSong(context);
            case FREE_TEXT -> handleFreeText(context);
            }
        } catch (RuntimeException e) {
            log.error("[Dispatcher] Unexpected failure on {}", context.key(), e);
            replyError(context, "error.generic");
        } finally {
            contexts.remove(context.key());
            log.debug("[Dispatcher] {} finished in state {}", context.key(), context.getState());
        }
    }

    private void handleLink(MessageContext context) {
        context.setState(MessageState.HANDLE_LINK);
        Optional<String> trackId = Optional.empty();
        for (String url : context.getInput().getUrls()) {
            if (!isSpotifyLink(url)) {
                continue;
            }
            try {
                trackId = catalogPort.extractTrackId(url);
            } catch (CatalogException e) {
                log.debug("[Dispatcher] Could not extract track id from {}: {}", url, e.getMessage());
            }
            if (trackId.isPresent()) {
                break;
            }
        }
        if (trackId.isEmpty()) {
            replyError(context, "error.spotify.extract_track_id");
            return;
        }
        addIfNew(context, trackId.get());
    }

    private void askWhichSong(MessageContext context) {
        context.setState(MessageState.ASK_WHICH_SONG);
        reply(context.getOrigin(), messageService.getMessage("prompt.which_song"), false);
    }

    private void handleFreeText(MessageContext context) {
        String text = context.getInput().getText();
        if (text == null || text.isBlank() || isNotMusicRequest(text)) {
            context.setState(MessageState.REACT_IGNORED);
            String id = context.getOrigin().getId();
            react(context.getOrigin(), Reaction.IGNORED.get(id.length() % Reaction.IGNORED.size()));
            log.debug("[Dispatcher] Ignored chatter: {}", text);
            return;
        }
        disambiguate(context);
    }

    boolean isNotMusicRequest(String text) {
        if (!rankingPort.isAvailable()) {
            return isLikelyChatter(text);
        }
        try {
            return rankingPort.isNotMusicRequest(text);
        } catch (RuntimeException e) {
            log.warn("[Dispatcher] Chatter detection failed, using keywords: {}", e.getMessage());
            return isLikelyChatter(text);
        }
    }

    static boolean isLikelyChatter(String text) {
        if (text.trim().length() < MIN_REQUEST_LENGTH) {
            return true;
        }
        return CHATTER.matcher(text.toLowerCase(Locale.ROOT)).find();
    }

    private void disambiguate(MessageContext context) {
        context.setState(MessageState.DISAMBIGUATE);
        TrackDisambiguator.Result result;
        try {
            result = disambiguator.disambiguate(context.getInput().getText());
        } catch (DisambiguationException e) {
            log.info("[Dispatcher] Disambiguation failed for {}: {}", context.key(), e.getMessage());
            replyError(context, e.getMessageKey());
            return;
        }
        context.setCandidates(result.candidates());

        RankedCandidate best = result.best();
        Track track = best.getTrack();
        boolean hasUrl = track.getUrl() != null && !track.getUrl().isBlank();
        double threshold = properties.getLlm().getConfidenceThreshold();

        if (hasUrl && (result.fallback() || best.getConfidence() >= threshold)) {
            confirm(context, track);
        } else {
            clarify(context, track);
        }
    }

    private void confirm(MessageContext context, Track track) {
        context.setState(MessageState.CONFIRMATION_PROMPT);
        String prompt = messageService.getMessage("prompt.enhanced_approval", track.getArtist(), track.getTitle(),
                TrackFormatter.details(messageService, track));
        if (awaitUser(context, prompt)) {
            handleApproval(context);
        } else {
            react(context.getOrigin(), Reaction.THUMBS_DOWN);
            askWhichSong(context);
        }
    }

    private void clarify(MessageContext context, Track track) {
        context.setState(MessageState.CLARIFY_ASK);
        String prompt = messageService.getMessage("prompt.clarification", track.getArtist(), track.getTitle());
        if (awaitUser(context, prompt)) {
            handleApproval(context);
        } else {
            askWhichSong(context);
        }
    }

    private boolean awaitUser(MessageContext context, String prompt) {
        try {
            return Boolean.TRUE.equals(userApprovalService.requestApproval(context.getOrigin(), prompt,
                    properties.getApp().getConfirmTimeoutSeconds()).get());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        } catch (ExecutionException e) {
            log.warn("[Dispatcher] Confirmation failed for {}: {}", context.key(), e.getCause().getMessage());
            return false;
        }
    }

    private void handleApproval(MessageContext context) {
        Track best = context.getCandidates().get(0).getTrack();
        String trackId = best.getId();
        if (trackId == null || trackId.isBlank()) {
            try {
                List<Track> found = catalogPort.searchTracks(best.getArtist() + " " + best.getTitle());
                trackId = found.isEmpty() ? null : found.get(0).getId();
            } catch (CatalogException e) {
                log.warn("[Dispatcher] Lookup failed for {}: {}", best.displayName(), e.getMessage());
            }
        }
        if (trackId == null || trackId.isBlank()) {
            replyError(context, "error.spotify.not_found");
            return;
        }
        addIfNew(context, trackId);
    }

    private void addIfNew(MessageContext context, String trackId) {
        context.setSelectedTrackId(trackId);
        if (dedupStore.has(trackId)) {
            context.setState(MessageState.REACT_DUPLICATE);
            react(context.getOrigin(), Reaction.THUMBS_DOWN);
            reply(context.getOrigin(), messageService.getMessage("success.duplicate"), true);
            return;
        }
        addToPlaylist(context, trackId);
    }

    // ==================== Playlist mutation policy ====================

    private void addToPlaylist(MessageContext context, String trackId) {
        ChatMessage origin = context.getOrigin();
        boolean senderIsAdmin = isAdmin(origin);

        if (senderIsAdmin && isPriorityRequest(context.getInput().getText())) {
            context.setState(MessageState.ADD_TO_PLAYLIST);
            PriorityPlacement placement;
            try {
                placement = mutationService.addPriorityTrack(trackId);
            } catch (PlaylistMutationException e) {
                log.warn("[Dispatcher] Priority queueing failed for {}, adding to playlist instead: {}", trackId,
                        e.getMessage());
                executeAdd(context, trackId, "success.track_added");
                return;
            }
            reactAdded(context, trackId, placement == PriorityPlacement.QUEUE_AND_PLAYLIST
                    ? "success.track_priority_playing"
                    : "success.track_priority_queue_only");
            return;
        }

        boolean needsApproval = approvalGate.isAvailable()
                && (!senderIsAdmin || properties.getTelegram().isAdminNeedsApproval());
        if (needsApproval) {
            awaitApproval(context, trackId);
            return;
        }
        executeAdd(context, trackId, "success.track_added");
    }

    private void awaitApproval(MessageContext context, String trackId) {
        context.setState(MessageState.AWAITING_APPROVAL);
        Track track;
        try {
            track = catalogPort.getTrack(trackId);
        } catch (CatalogException e) {
            log.error("[Dispatcher] Failed to load track {} for approval: {}", trackId, e.getMessage());
            replyError(context, "error.admin.process_failed");
            return;
        }

        ApprovalOutcome outcome;
        try {
            outcome = approvalGate.awaitApproval(context.getOrigin(), track);
        } catch (RuntimeException e) {
            log.error("[Dispatcher] Approval failed for {}: {}", trackId, e.getMessage());
            replyError(context, "error.admin.process_failed");
            return;
        }

        if (!outcome.approved()) {
            log.info("[Dispatcher] {} denied for {}", track.displayName(), context.getOrigin().getSenderName());
            context.setState(MessageState.REACT_ERROR);
            react(context.getOrigin(), Reaction.THUMBS_DOWN);
            reply(context.getOrigin(), messageService.getMessage("admin.denied"), false);
            return;
        }
        log.info("[Dispatcher] {} approved by {}", track.displayName(), outcome.source());
        String successKey = outcome.source() == ApprovalSource.COMMUNITY
                ? "success.community_approved_and_added"
                : "success.admin_approved_and_added";
        executeAdd(context, trackId, successKey);
    }

    private void executeAdd(MessageContext context, String trackId, String successKey) {
        context.setState(MessageState.ADD_TO_PLAYLIST);
        try {
            mutationService.addTrack(trackId);
        } catch (PlaylistMutationException e) {
            log.error("[Dispatcher] Failed to add {}: {}", trackId, e.getMessage());
            replyError(context, "error.playlist.add_failed");
            return;
        }
        reactAdded(context, trackId, successKey);
    }

    private void reactAdded(MessageContext context, String trackId, String messageKey) {
        context.setState(MessageState.REACT_ADDED);
        ChatMessage origin = context.getOrigin();
        react(origin, Reaction.THUMBS_UP);

        Track track;
        try {
            track = catalogPort.getTrack(trackId);
        } catch (CatalogException e) {
            log.warn("[Dispatcher] Failed to load added track {}: {}", trackId, e.getMessage());
            track = Track.builder().id(trackId).title(UNKNOWN).artist(UNKNOWN).url("").build();
        }

        String queueKey = queueVariant(messageKey);
        if (queueKey != null) {
            int position = queuePosition(trackId);
            if (position >= 0) {
                reply(origin, messageService.getMessage(queueKey, track.getArtist(), track.getTitle(),
                        track.getUrl(), String.valueOf(position + 1)), true);
                return;
            }
        }
        reply(origin, messageService.getMessage(messageKey, track.getArtist(), track.getTitle(), track.getUrl()),
                true);
    }

    private static String queueVariant(String messageKey) {
        return switch (messageKey) {
        case "success.track_added" -> "success.track_added_with_queue";
        case "success.admin_approved_and_added" -> "success.admin_approved_and_added_queue";
        case "success.community_approved_and_added" -> "success.community_approved_and_added_queue";
        default -> null;
        };
    }

    private int queuePosition(String trackId) {
        try {
            return catalogPort.getTrackPosition(trackId);
        } catch (CatalogException e) {
            log.debug("[Dispatcher] Queue position unavailable for {}: {}", trackId, e.getMessage());
            return -1;
        }
    }

    private boolean isAdmin(ChatMessage origin) {
        try {
            return frontend.isUserAdmin(origin.getChatId(), origin.getSenderId());
        } catch (RuntimeException e) {
            log.debug("[Dispatcher] Admin check failed for {}: {}", origin.getSenderId(), e.getMessage());
            return false;
        }
    }

    private boolean isPriorityRequest(String text) {
        if (text == null || text.isBlank() || !rankingPort.isAvailable()) {
            return false;
        }
        try {
            return rankingPort.isPriorityRequest(text);
        } catch (RuntimeException e) {
            log.debug("[Dispatcher] Priority detection failed: {}", e.getMessage());
            return false;
        }
    }

    // ==================== Replies ====================

    private void replyError(MessageContext context, String messageKey) {
        context.setState(MessageState.REACT_ERROR);
        reply(context.getOrigin(), messageService.getMessage(messageKey), true);
    }

    private void reply(ChatMessage origin, String text, boolean mention) {
        String body = mention ? withMention(origin, text) : text;
        try {
            frontend.sendText(origin.getChatId(), origin.getId(), body);
        } catch (RuntimeException e) {
            log.warn("[Dispatcher] Failed to reply in {}: {}", origin.getChatId(), e.getMessage());
        }
    }

    static String withMention(ChatMessage origin, String text) {
        String name = origin.getSenderName();
        if (name == null || name.isBlank()) {
            return text;
        }
        String mention = name.startsWith("@") ? name : "@" + name;
        return mention + " " + text;
    }

    private void react(ChatMessage origin, String emoji) {
        try {
            frontend.react(origin.getChatId(), origin.getId(), emoji);
        } catch (RuntimeException e) {
            log.debug("[Dispatcher] Failed to react {} on {}: {}", emoji, origin.getId(), e.getMessage());
        }
    }

    private void sendToGroup(String messageKey) {
        String groupId = properties.getTelegram().getGroupId();
        if (groupId == null || groupId.isBlank()) {
            return;
        }
        try {
            String playlistUrl = catalogPort.getPlaylistUrl();
            frontend.sendText(groupId, null, messageService.getMessage(messageKey, playlistUrl));
        } catch (RuntimeException e) {
            log.warn("[Dispatcher] Failed to send {} to group: {}", messageKey, e.getMessage());
        }
    }
}
