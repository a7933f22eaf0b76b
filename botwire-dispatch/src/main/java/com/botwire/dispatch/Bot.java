package com.botwire.dispatch;

import com.botwire.api.client.BotApi;
import com.botwire.api.types.CallbackQuery;
import com.botwire.api.types.ChatJoinRequest;
import com.botwire.api.types.ChatMemberUpdated;
import com.botwire.api.types.ChosenInlineResult;
import com.botwire.api.types.InlineQuery;
import com.botwire.api.types.Message;
import com.botwire.api.types.Poll;
import com.botwire.api.types.PollAnswer;
import com.botwire.api.types.PreCheckoutQuery;
import com.botwire.api.types.ShippingQuery;
import com.botwire.api.types.Update;
import com.botwire.api.types.UpdateKind;
import com.botwire.common.config.BotConfig;
import com.botwire.common.config.ConfigValidation;
import com.botwire.common.errors.BotException;
import com.botwire.dispatch.filter.AdvancedCustomFilter;
import com.botwire.dispatch.filter.CustomFilters;
import com.botwire.dispatch.filter.FilterFactory;
import com.botwire.dispatch.filter.FilterRegistry;
import com.botwire.dispatch.filter.FilterSpec;
import com.botwire.dispatch.filter.ResolvedFilter;
import com.botwire.dispatch.filter.SimpleCustomFilter;
import com.botwire.dispatch.middleware.Middleware;
import com.botwire.dispatch.poller.PollerMonitor;
import com.botwire.dispatch.poller.UpdateOffsetStore;
import com.botwire.dispatch.poller.UpdatePoller;
import com.botwire.dispatch.state.MemoryStateStorage;
import com.botwire.dispatch.state.StateFilter;
import com.botwire.dispatch.state.StateStorage;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Entry point for application code: an API client plus handler registration, dispatch and polling.
 * <pre>{@code
 * Bot bot = new Bot(new ConfigService(Path.of("bot.json")).loadConfig());
 * bot.onMessage((msg, ctx) -> bot.getApi().replyTo(msg, "Hi!"), Filters.commands("start"));
 * bot.onMessage((msg, ctx) -> bot.getApi().replyTo(msg, msg.getText()));
 * bot.startPolling();
 * }</pre>
 * Conversation state lives in a {@link StateStorage} (in memory by default) and is matched with
 * {@code Filters.state(...)}.
 * <p>
 * Filters are resolved when a handler is registered, so an unknown filter name or a bad argument
 * fails there with a {@link com.botwire.common.errors.ConfigurationException}.
 */
@Slf4j
public class Bot implements AutoCloseable {

    private final BotApi api;
    private final BotConfig config;
    private final FilterRegistry filterRegistry = new FilterRegistry();
    private final HandlerRegistry handlerRegistry = new HandlerRegistry();
    private final Dispatcher dispatcher;
    private final PollerMonitor monitor;
    private final StateStorage stateStorage;
    private volatile UpdatePoller poller;
    private boolean callerPolling;

    /**
     * @throws com.botwire.common.errors.ConfigurationException if the config fails validation
     */
    public Bot(BotConfig config) {
        this(BotApi.create(ConfigValidation.requireValid(config)), config);
    }

    public Bot(BotApi api, BotConfig config) {
        this(api, config, new MemoryStateStorage());
    }

    public Bot(BotApi api, BotConfig config, StateStorage stateStorage) {
        this.api = Objects.requireNonNull(api, "api");
        this.stateStorage = Objects.requireNonNull(stateStorage, "stateStorage");
        this.config = config != null ? config : new BotConfig();
        BotConfig.DispatchConfig dispatchConfig = this.config.getDispatch() != null
                ? this.config.getDispatch() : new BotConfig.DispatchConfig();
        this.dispatcher = new Dispatcher(handlerRegistry, dispatchConfig);
        this.monitor = new PollerMonitor(UpdateOffsetStore.botId(this.config.getToken()),
                pollingConfig().getStallThresholdMs(), System::currentTimeMillis);
        filterRegistry.registerCustomFilter(new StateFilter(stateStorage));
    }

    public BotApi getApi() {
        return api;
    }

    public Dispatcher getDispatcher() {
        return dispatcher;
    }

    public FilterRegistry getFilterRegistry() {
        return filterRegistry;
    }

    public HandlerRegistry getHandlerRegistry() {
        return handlerRegistry;
    }

    public PollerMonitor getMonitor() {
        return monitor;
    }

    public StateStorage getStateStorage() {
        return stateStorage;
    }

    // =========================================================================
    // Handler registration
    // =========================================================================

    /**
     * Register a handler for any kind.
     */
    public HandlerRegistration register(UpdateKind kind, UpdateHandler handler, HandlerOptions options,
            FilterSpec... filters) {
        return register(kind, handler, handler, options, filters);
    }

    public HandlerRegistration register(UpdateKind kind, UpdateHandler handler, FilterSpec... filters) {
        return register(kind, handler, handler, HandlerOptions.DEFAULT, filters);
    }

    /**
     * Register a handler that receives the payload of {@code kind}, e.g. a {@link Message} for
     * {@link UpdateKind#EDITED_MESSAGE}.
     */
    @SuppressWarnings("unchecked")
    public <T> HandlerRegistration on(UpdateKind kind, PayloadHandler<T> handler, HandlerOptions options,
            FilterSpec... filters) {
        Objects.requireNonNull(handler, "handler");
        UpdateHandler adapter = (update, ctx) -> handler.handle((T) update.getPayload(), ctx);
        return register(kind, adapter, handler, options, filters);
    }

    public HandlerRegistration onMessage(PayloadHandler<Message> handler, FilterSpec... filters) {
        return on(UpdateKind.MESSAGE, handler, HandlerOptions.DEFAULT, filters);
    }

    public HandlerRegistration onEditedMessage(PayloadHandler<Message> handler, FilterSpec... filters) {
        return on(UpdateKind.EDITED_MESSAGE, handler, HandlerOptions.DEFAULT, filters);
    }

    public HandlerRegistration onChannelPost(PayloadHandler<Message> handler, FilterSpec... filters) {
        return on(UpdateKind.CHANNEL_POST, handler, HandlerOptions.DEFAULT, filters);
    }

    public HandlerRegistration onEditedChannelPost(PayloadHandler<Message> handler, FilterSpec... filters) {
        return on(UpdateKind.EDITED_CHANNEL_POST, handler, HandlerOptions.DEFAULT, filters);
    }

    public HandlerRegistration onCallbackQuery(PayloadHandler<CallbackQuery> handler, FilterSpec... filters) {
        return on(UpdateKind.CALLBACK_QUERY, handler, HandlerOptions.DEFAULT, filters);
    }

    public HandlerRegistration onInlineQuery(PayloadHandler<InlineQuery> handler, FilterSpec... filters) {
        return on(UpdateKind.INLINE_QUERY, handler, HandlerOptions.DEFAULT, filters);
    }

    public HandlerRegistration onChosenInlineResult(PayloadHandler<ChosenInlineResult> handler,
            FilterSpec... filters) {
        return on(UpdateKind.CHOSEN_INLINE_RESULT, handler, HandlerOptions.DEFAULT, filters);
    }

    public HandlerRegistration onShippingQuery(PayloadHandler<ShippingQuery> handler, FilterSpec... filters) {
        return on(UpdateKind.SHIPPING_QUERY, handler, HandlerOptions.DEFAULT, filters);
    }

    public HandlerRegistration onPreCheckoutQuery(PayloadHandler<PreCheckoutQuery> handler,
            FilterSpec... filters) {
        return on(UpdateKind.PRE_CHECKOUT_QUERY, handler, HandlerOptions.DEFAULT, filters);
    }

    public HandlerRegistration onPoll(PayloadHandler<Poll> handler, FilterSpec... filters) {
        return on(UpdateKind.POLL, handler, HandlerOptions.DEFAULT, filters);
    }

    public HandlerRegistration onPollAnswer(PayloadHandler<PollAnswer> handler, FilterSpec... filters) {
        return on(UpdateKind.POLL_ANSWER, handler, HandlerOptions.DEFAULT, filters);
    }

    public HandlerRegistration onMyChatMember(PayloadHandler<ChatMemberUpdated> handler, FilterSpec... filters) {
        return on(UpdateKind.MY_CHAT_MEMBER, handler, HandlerOptions.DEFAULT, filters);
    }

    public HandlerRegistration onChatMember(PayloadHandler<ChatMemberUpdated> handler, FilterSpec... filters) {
        return on(UpdateKind.CHAT_MEMBER, handler, HandlerOptions.DEFAULT, filters);
    }

    public HandlerRegistration onChatJoinRequest(PayloadHandler<ChatJoinRequest> handler, FilterSpec... filters) {
        return on(UpdateKind.CHAT_JOIN_REQUEST, handler, HandlerOptions.DEFAULT, filters);
    }

    /**
     * Remove every registration made with {@code handler}.
     *
     * @return number of registrations removed
     */
    public int unregister(Object handler) {
        return handlerRegistry.unregister(handler);
    }

    public boolean unregister(HandlerRegistration registration) {
        return handlerRegistry.unregister(registration);
    }

    private HandlerRegistration register(UpdateKind kind, UpdateHandler handler, Object callback,
            HandlerOptions options, FilterSpec[] filters) {
        Objects.requireNonNull(kind, "kind");
        List<ResolvedFilter> resolved = filterRegistry.resolveAll(kind, List.of(filters));
        return handlerRegistry.register(kind, handler, callback, resolved, options);
    }

    // =========================================================================
    // Filters, middleware, listeners
    // =========================================================================

    public void registerFilter(String name, FilterFactory factory) {
        filterRegistry.registerFilter(name, factory);
    }

    public void registerCustomFilter(SimpleCustomFilter filter) {
        filterRegistry.registerCustomFilter(filter);
    }

    public void registerCustomFilter(AdvancedCustomFilter filter) {
        filterRegistry.registerCustomFilter(filter);
    }

    /**
     * Register all ready-made custom filters, including {@code is_chat_admin} bound to this bot's API.
     */
    public void registerDefaultCustomFilters() {
        CustomFilters.registerDefaults(filterRegistry);
        filterRegistry.registerCustomFilter(new CustomFilters.IsChatAdmin(api));
    }

    public void addMiddleware(Middleware middleware) {
        dispatcher.addMiddleware(middleware);
    }

    public void addUpdateListener(UpdateListener listener) {
        dispatcher.addUpdateListener(listener);
    }

    public void setErrorSink(ErrorSink sink) {
        dispatcher.setErrorSink(sink);
    }

    // =========================================================================
    // Conversation state
    // =========================================================================

    /**
     * Set the state of a user in a chat; existing data is kept.
     */
    public void setState(long chatId, long userId, String state) {
        stateStorage.setState(chatId, userId, state);
    }

    /**
     * Set the state of a user in their private chat with the bot.
     */
    public void setState(long userId, String state) {
        stateStorage.setState(userId, userId, state);
    }

    public String getState(long chatId, long userId) {
        return stateStorage.getState(chatId, userId);
    }

    public boolean deleteState(long chatId, long userId) {
        return stateStorage.deleteState(chatId, userId);
    }

    /**
     * @throws IllegalStateException if the user has no state in the chat
     */
    public void addData(long chatId, long userId, Map<String, ?> data) {
        stateStorage.updateData(chatId, userId, current -> current.putAll(data));
    }

    public Map<String, Object> getData(long chatId, long userId) {
        return stateStorage.getData(chatId, userId);
    }

    public boolean resetData(long chatId, long userId) {
        return stateStorage.resetData(chatId, userId);
    }

    /**
     * Read and change the data of a user in one step, see {@link StateStorage#updateData}.
     */
    public void retrieveData(long chatId, long userId, Consumer<Map<String, Object>> editor) {
        stateStorage.updateData(chatId, userId, editor);
    }

    // =========================================================================
    // Next-step handlers
    // =========================================================================

    /**
     * Let {@code handler} take the next message in the chat of {@code message}, in place of the
     * regular message handlers.
     */
    public void registerNextStepHandler(Message message, PayloadHandler<Message> handler) {
        registerNextStepHandlerByChatId(message.getChat().getId(), handler);
    }

    public void registerNextStepHandlerByChatId(long chatId, PayloadHandler<Message> handler) {
        dispatcher.getNextSteps().register(chatId, handler);
    }

    /**
     * @return number of pending handlers dropped
     */
    public int clearStepHandler(Message message) {
        return clearStepHandlerByChatId(message.getChat().getId());
    }

    public int clearStepHandlerByChatId(long chatId) {
        return dispatcher.getNextSteps().clear(chatId);
    }

    /**
     * Dispatch updates obtained elsewhere, e.g. from a webhook or {@link BotApi#getUpdates}.
     */
    public void processNewUpdates(List<Update> updates) {
        dispatcher.dispatchBatch(updates);
    }

    // =========================================================================
    // Polling
    // =========================================================================

    /**
     * Start polling on a background thread.
     *
     * @throws IllegalStateException if polling is already running
     */
    public synchronized UpdatePoller startPolling() {
        UpdatePoller p = newPoller();
        p.start();
        return p;
    }

    /**
     * Poll on the calling thread until {@link #stopPolling()} is called from another thread.
     *
     * @throws IllegalStateException if polling is already running
     */
    public void pollForever() {
        UpdatePoller p;
        synchronized (this) {
            p = newPoller();
            callerPolling = true;
        }
        try {
            p.run();
        } finally {
            synchronized (this) {
                callerPolling = false;
            }
        }
    }

    public void stopPolling() {
        UpdatePoller p = poller;
        if (p != null) {
            p.stop();
        }
    }

    public UpdatePoller getPoller() {
        return poller;
    }

    /**
     * A new poller that continues from the previous one's offset. Caller holds the lock.
     */
    private UpdatePoller newPoller() {
        UpdatePoller current = poller;
        if (callerPolling || (current != null && current.isRunning())) {
            throw new IllegalStateException("polling already running");
        }
        if (current != null && !awaitPrevious(current)) {
            throw new IllegalStateException("previous polling loop is still finishing its batch");
        }
        BotConfig.PollingConfig polling = pollingConfig();
        UpdateOffsetStore store = polling.getOffsetStateDir() != null && !polling.getOffsetStateDir().isBlank()
                ? UpdateOffsetStore.forBot(Path.of(polling.getOffsetStateDir()), config.getToken())
                : null;
        long resumeFrom = current != null ? current.getOffset() : 0;
        UpdatePoller p = new UpdatePoller(api.getTransport(), api.getUpdateParser(), dispatcher, polling, store,
                monitor, resumeFrom);
        poller = p;
        return p;
    }

    private static boolean awaitPrevious(UpdatePoller previous) {
        try {
            return previous.awaitStop(Duration.ofSeconds(30));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BotException("Interrupted while waiting for the previous polling loop", e);
        }
    }

    private BotConfig.PollingConfig pollingConfig() {
        return config.getPolling() != null ? config.getPolling() : new BotConfig.PollingConfig();
    }

    /**
     * Stop polling, drain the dispatcher and close the API client.
     */
    @Override
    public void close() {
        UpdatePoller p = poller;
        if (p != null) {
            p.close();
        }
        dispatcher.close();
        api.close();
        log.info("Bot closed");
    }
}
