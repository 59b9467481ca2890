package com.example.dutybot.reminder;

import com.example.dutybot.config.BotProperties;
import com.example.dutybot.config.Contact;
import com.example.dutybot.config.DutyConfig;
import com.example.dutybot.config.ProviderConfig;
import com.example.dutybot.config.ReminderConfig;
import com.example.dutybot.config.Roster;
import com.example.dutybot.domain.AggregatedState;
import com.example.dutybot.domain.DutyState;
import com.example.dutybot.domain.Person;
import com.example.dutybot.loop.LoopApi;
import com.example.dutybot.loop.LoopApiException;
import com.example.dutybot.loop.LoopPost;
import com.example.dutybot.loop.LoopUser;
import com.example.dutybot.provider.ProviderKind;
import com.example.dutybot.reconciler.ScheduleReconciler;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import okhttp3.OkHttpClient;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZonedDateTime;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Daily duty reminder.
 *
 * At the configured time the person currently on duty is mentioned in the
 * Loop channel and asked to answer {@code @take} in the thread. Until they do,
 * a reminder is posted in the same thread every reminder interval.
 * Acknowledgements arrive either as Loop message events pushed to
 * {@code POST /events/loop} or are found by polling the thread.
 *
 * The person comes from the {@code loop} lane, then any other lane, then the
 * weekday schedule of the contact directory. Operators can also start a
 * session or send a one-off ping for a named contact.
 */
@Slf4j
@Service
public class DutyReminderService {

    static final String TAKE_COMMAND = "@take";

    private final ReminderConfig config;
    private final Roster roster;
    private final LoopApi loopApi;
    private final ScheduleReconciler reconciler;
    private final BotProperties properties;
    private final Clock clock;

    private final AtomicReference<ReminderSession> session = new AtomicReference<>();
    private LocalDate lastSessionDate;

    @Autowired
    public DutyReminderService(DutyConfig dutyConfig, ScheduleReconciler reconciler, BotProperties properties,
                               OkHttpClient httpClient, ObjectMapper objectMapper) {
        this(dutyConfig.reminder(), dutyConfig.roster(), loopApi(dutyConfig.loop(), httpClient, objectMapper),
                reconciler, properties, Clock.systemUTC());
    }

    public DutyReminderService(ReminderConfig config, Roster roster, LoopApi loopApi, ScheduleReconciler reconciler,
                               BotProperties properties, Clock clock) {
        this.config = config;
        this.roster = roster;
        this.loopApi = loopApi;
        this.reconciler = reconciler;
        this.properties = properties;
        this.clock = clock;
        if (config != null) {
            log.info("Duty reminder scheduled daily at {} {} in channel {}",
                    config.dailyTime(), config.timezone(), config.channel());
        }
    }

    private static LoopApi loopApi(ProviderConfig loop, OkHttpClient httpClient, ObjectMapper objectMapper) {
        return new LoopApi(loop.baseUrl(), loop.token(), loop.team(), loop.timeout(), httpClient, objectMapper);
    }

    public boolean isEnabled() {
        return config != null && properties.getReminder().isEnabled();
    }

    /**
     * Runs on the scheduler only. Loop calls are made here; {@link #handleEvent} never waits for them.
     */
    @Scheduled(fixedDelayString = "${duty-bot.reminder.check-interval-millis:30000}")
    public synchronized void check() {
        if (!isEnabled()) return;

        ZonedDateTime now = ZonedDateTime.ofInstant(clock.instant(), config.timezone());
        LocalDate today = now.toLocalDate();
        boolean pastDailyTime = !now.toLocalTime().isBefore(config.dailyTime());
        if (lastSessionDate == null) {
            // started after today's reminder time: first reminder is tomorrow
            lastSessionDate = pastDailyTime ? today : today.minusDays(1);
        }

        if (!today.equals(lastSessionDate) && pastDailyTime) {
            startDailySession(today);
            return;
        }

        ReminderSession current = session.get();
        if (current == null || current.isAcknowledged()) return;

        pollThreadForAcknowledgement(current);
        if (!current.isAcknowledged()
                && !clock.instant().isBefore(current.getLastSentAt().plus(config.reminderInterval()))) {
            sendReminder(current);
        }
    }

    private void startDailySession(LocalDate today) {
        Optional<Person> person = currentDutyPerson(today);
        if (person.isEmpty()) {
            log.warn("No duty person known for {}, skipping the daily reminder", today);
            lastSessionDate = today;
            return;
        }
        if (openSession(person.get())) {
            lastSessionDate = today;
        }
    }

    private boolean openSession(Person contact) {
        log.info("Notifying duty contact {} ({})", contact.displayName(), contact.id());
        try {
            LoopPost post = loopApi.sendMessage(config.channel(), initialMessage(contact), null);
            session.set(new ReminderSession(contact, post.rootId(), clock.instant()));
            log.debug("Initial message sent with id {}", post.id());
            return true;
        } catch (LoopApiException e) {
            log.error("Failed to post the duty reminder, will retry: {}", e.getMessage());
            return false;
        }
    }

    private void sendReminder(ReminderSession current) {
        log.info("No acknowledgement yet from {}, sending reminder", current.getContact().id());
        try {
            loopApi.sendMessage(config.channel(), reminderMessage(current.getContact()), current.getThreadId());
            current.setLastSentAt(clock.instant());
        } catch (LoopApiException e) {
            log.error("Failed to post duty reminder, will retry: {}", e.getMessage());
        }
    }

    private void pollThreadForAcknowledgement(ReminderSession current) {
        try {
            for (LoopPost post : loopApi.fetchThread(current.getThreadId())) {
                if (post.userId().isEmpty() || !containsTake(post.message())) continue;
                LoopUser author = loopApi.getUser(post.userId());
                if (current.getContact().id().equals(author.ldap())
                        || current.getContact().id().equals(author.username())) {
                    acknowledge(current, author.ldap());
                    return;
                }
            }
        } catch (LoopApiException e) {
            log.warn("Failed to read reminder thread {}: {}", current.getThreadId(), e.getMessage());
        }
    }

    /**
     * Handles a Loop message event, e.g. from an outgoing webhook.
     * Lock-free, so request threads never wait for the scheduler's Loop calls.
     *
     * @return true if the event acknowledged the running reminder
     */
    public boolean handleEvent(JsonNode event) {
        ReminderSession current = session.get();
        if (current == null || current.isAcknowledged() || event == null) return false;
        if (!"message".equals(event.path("type").asText())) return false;

        String rootId = event.path("root_id").asText("");
        if (!rootId.isEmpty() && !rootId.equals(current.getThreadId())) return false;

        JsonNode user = event.path("user");
        String ldap = user.path("ldap").asText(user.path("username").asText(""));
        if (ldap.equals(current.getContact().id()) && containsTake(event.path("text").asText(""))) {
            return acknowledge(current, ldap);
        }
        return false;
    }

    private boolean acknowledge(ReminderSession current, String ldap) {
        if (current.isAcknowledged()) {
            return false;
        }
        current.setAcknowledged(true);
        log.info("{} acknowledged the duty notification after {}s",
                ldap, Duration.between(current.getStartedAt(), clock.instant()).toSeconds());
        return true;
    }

    /**
     * Starts a reminder session for a contact of the directory right away,
     * unless an unacknowledged session is still running.
     */
    public ContactCommandResult triggerContact(String contactKey) {
        if (config == null) return ContactCommandResult.NOT_CONFIGURED;
        Optional<Contact> contact = roster.contact(contactKey);
        if (contact.isEmpty()) {
            log.warn("Unknown contact key {}", contactKey);
            return ContactCommandResult.UNKNOWN_CONTACT;
        }
        ReminderSession current = session.get();
        if (current != null && !current.isAcknowledged()) {
            log.warn("Cannot trigger {} because a reminder session is already in progress", contactKey);
            return ContactCommandResult.SESSION_IN_PROGRESS;
        }
        return openSession(contact.get().toPerson()) ? ContactCommandResult.ACCEPTED : ContactCommandResult.FAILED;
    }

    /**
     * Posts the initial duty message for a contact without starting a session.
     */
    public ContactCommandResult pingContact(String contactKey) {
        if (config == null) return ContactCommandResult.NOT_CONFIGURED;
        Optional<Contact> contact = roster.contact(contactKey);
        if (contact.isEmpty()) {
            log.warn("Unknown contact key {}", contactKey);
            return ContactCommandResult.UNKNOWN_CONTACT;
        }
        Person person = contact.get().toPerson();
        log.info("Sending ping message to {} ({})", person.displayName(), person.id());
        try {
            loopApi.sendMessage(config.channel(), initialMessage(person), null);
            return ContactCommandResult.ACCEPTED;
        } catch (LoopApiException e) {
            log.error("Failed to ping {}: {}", contactKey, e.getMessage());
            return ContactCommandResult.FAILED;
        }
    }

    private Optional<Person> currentDutyPerson(LocalDate today) {
        AggregatedState state = reconciler.getSnapshot();
        return state.get(ProviderKind.LOOP.tableName())
                .or(() -> state.states().values().stream().findFirst())
                .map(DutyState::person)
                .or(() -> roster.contactFor(today).map(Contact::toPerson));
    }

    private static boolean containsTake(String text) {
        return text.toLowerCase(Locale.ROOT).contains(TAKE_COMMAND);
    }

    static String initialMessage(Person contact) {
        return "@" + contact.id() + " Доброе утро. Ты сегодня дежурный, напиши " + TAKE_COMMAND
                + " в чат, чтобы я понял что ты увидел это сообщение";
    }

    static String reminderMessage(Person contact) {
        return "@" + contact.id() + " напомню, что сегодня твоя дежурная смена. Напиши " + TAKE_COMMAND
                + " в ответном треде";
    }

    public Optional<ReminderSession> getSession() {
        return Optional.ofNullable(session.get());
    }
}
