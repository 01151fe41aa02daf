package com.yourapp.habits.habit_ledger.service;

import com.yourapp.habits.habit_ledger.exception.DeliveryFailureException;
import com.yourapp.habits.habit_ledger.model.Habit;
import com.yourapp.habits.habit_ledger.model.Schedule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.*;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Sends the daily prompt as a Telegram poll to the habit owner's private chat.
 */
@Service
@ConditionalOnProperty(prefix = "telegram", name = "enabled", havingValue = "true")
public class TelegramPromptDelivery implements PromptDelivery {
    private static final Logger logger = LoggerFactory.getLogger(TelegramPromptDelivery.class);

    static final ParameterizedTypeReference<Map<String, Object>> RESPONSE_TYPE =
        new ParameterizedTypeReference<>() {
        };
    static final List<String> POLL_OPTIONS = List.of("Yes, I completed it!", "No, not yet");
    private static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ofPattern("MMM d");

    private final String apiUrl;
    private final String botToken;
    private final RestTemplate rest;
    private final Clock clock;

    @Autowired
    public TelegramPromptDelivery(@Value("${telegram.api-url:https://api.telegram.org}") String apiUrl,
                                  @Value("${telegram.bot-token}") String botToken,
                                  @Value("${habits.dispatch.delivery-timeout:10s}") Duration timeout,
                                  RestTemplateBuilder builder,
                                  Clock clock) {
        this(apiUrl, botToken, builder
            .setConnectTimeout(timeout)
            .setReadTimeout(timeout)
            .build(), clock);
    }

    TelegramPromptDelivery(String apiUrl, String botToken, RestTemplate rest, Clock clock) {
        this.apiUrl = apiUrl;
        this.botToken = botToken;
        this.rest = rest;
        this.clock = clock;
    }

    @Override
    public boolean deliver(Habit habit, Schedule schedule, LocalDate promptDate) {
        String url = apiUrl + "/bot" + botToken + "/sendPoll";

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setAccept(Collections.singletonList(MediaType.APPLICATION_JSON));

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("chat_id", habit.getOwnerId());
        body.put("question", question(habit, schedule, promptDate));
        body.put("options", POLL_OPTIONS);
        body.put("is_anonymous", false);
        body.put("allows_multiple_answers", false);

        HttpEntity<Map<String, Object>> request = new HttpEntity<>(body, headers);

        try {
            ResponseEntity<Map<String, Object>> response = rest.exchange(url, HttpMethod.POST, request, RESPONSE_TYPE);
            Map<String, Object> payload = response.getBody();
            boolean ok = response.getStatusCode().is2xxSuccessful()
                && payload != null && Boolean.TRUE.equals(payload.get("ok"));
            if (!ok) {
                logger.warn("Telegram refused prompt for habit {}: {}", habit.getId(), payload);
            }
            return ok;
        } catch (RestClientException e) {
            throw new DeliveryFailureException("Telegram sendPoll failed for habit " + habit.getId(), e);
        }
    }

    String question(Habit habit, Schedule schedule, LocalDate promptDate) {
        LocalDate scheduleToday = LocalDate.now(clock.withZone(schedule.getZoneId()));
        String when = promptDate.equals(scheduleToday) ? "today" : "on " + promptDate.format(DATE_FORMAT);
        return "Reminder: did you complete \"" + habit.getName() + "\" " + when + "?";
    }
}
