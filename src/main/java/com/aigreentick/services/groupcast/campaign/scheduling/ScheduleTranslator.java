package com.aigreentick.services.groupcast.campaign.scheduling;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import org.springframework.scheduling.support.CronExpression;
import org.springframework.stereotype.Component;

import com.aigreentick.services.groupcast.campaign.enums.Frequency;
import com.aigreentick.services.groupcast.campaign.enums.ScheduleType;
import com.aigreentick.services.groupcast.campaign.model.ScheduleDescriptor;
import com.aigreentick.services.groupcast.config.GroupcastProperties;

import lombok.extern.slf4j.Slf4j;

/**
 * Turns a campaign's {@link ScheduleDescriptor} into a {@link TriggerSpec}.
 * <p>
 * Cron output uses Spring's six-field format with second fixed to 0:
 * <ul>
 *   <li>once: {@code 0 m h d M *}</li>
 *   <li>daily: {@code 0 m h * * *}</li>
 *   <li>weekly: {@code 0 m h * * d1,d2}</li>
 * </ul>
 * Nothing is defaulted: a missing or malformed field is a {@link ScheduleValidationException}.
 */
@Slf4j
@Component
public class ScheduleTranslator {

    private static final Pattern TIME_PATTERN = Pattern.compile("^([01]?\\d|2[0-3]):([0-5]\\d)$");

    private final Clock clock;
    private final ZoneId zone;
    private final GroupcastProperties properties;

    public ScheduleTranslator(Clock clock, GroupcastProperties properties) {
        this.clock = clock;
        this.properties = properties;
        this.zone = properties.zoneId();
    }

    public TriggerSpec translate(ScheduleDescriptor descriptor) {
        if (descriptor == null || descriptor.getType() == null) {
            throw new ScheduleValidationException("type", "schedule type is required");
        }

        return switch (descriptor.getType()) {
            case IMMEDIATE -> immediate();
            case ONCE -> once(descriptor);
            case RECURRING -> recurring(descriptor);
        };
    }

    /**
     * @return true for a one-time schedule whose moment is not in the future
     */
    public boolean hasElapsed(ScheduleDescriptor descriptor) {
        return descriptor != null
                && descriptor.getType() == ScheduleType.ONCE
                && descriptor.getDatetime() != null
                && !descriptor.getDatetime().atZone(zone).toInstant().isAfter(clock.instant());
    }

    private TriggerSpec immediate() {
        Instant fireAt = clock.instant().plus(properties.getCampaigns().getImmediateDelay());
        return TriggerSpec.oneShot(fireAt, cronFor(fireAt.atZone(zone)), zone);
    }

    private TriggerSpec once(ScheduleDescriptor descriptor) {
        if (descriptor.getDatetime() == null) {
            throw new ScheduleValidationException("datetime", "required for a one-time schedule");
        }

        ZonedDateTime fireAt = descriptor.getDatetime().atZone(zone);
        if (!fireAt.toInstant().isAfter(clock.instant())) {
            throw new ScheduleValidationException("datetime", "must be in the future: " + descriptor.getDatetime());
        }

        return TriggerSpec.oneShot(fireAt.toInstant(), cronFor(fireAt), zone);
    }

    private TriggerSpec recurring(ScheduleDescriptor descriptor) {
        if (descriptor.getFrequency() == null) {
            throw new ScheduleValidationException("frequency", "required for a recurring schedule");
        }

        int[] hourMinute = parseTime(descriptor.getTime());
        int hour = hourMinute[0];
        int minute = hourMinute[1];

        String cron;
        if (descriptor.getFrequency() == Frequency.DAILY) {
            cron = String.format("0 %d %d * * *", minute, hour);
        } else {
            cron = String.format("0 %d %d * * %s", minute, hour, daysField(descriptor.getDaysOfWeek()));
        }

        // guards against anything this class assembled wrongly
        CronExpression.parse(cron);
        return TriggerSpec.recurring(cron, zone);
    }

    private static int[] parseTime(String time) {
        if (time == null) {
            throw new ScheduleValidationException("time", "required for a recurring schedule");
        }
        Matcher matcher = TIME_PATTERN.matcher(time.trim());
        if (!matcher.matches()) {
            throw new ScheduleValidationException("time", "expected HH:MM but got '" + time + "'");
        }
        return new int[] { Integer.parseInt(matcher.group(1)), Integer.parseInt(matcher.group(2)) };
    }

    private static String daysField(List<Integer> daysOfWeek) {
        if (daysOfWeek == null || daysOfWeek.isEmpty()) {
            throw new ScheduleValidationException("daysOfWeek", "at least one day is required for a weekly schedule");
        }

        TreeSet<Integer> days = new TreeSet<>();
        for (Integer day : daysOfWeek) {
            if (day == null || day < 0 || day > 6) {
                throw new ScheduleValidationException("daysOfWeek", "days must be between 0 (Sunday) and 6, got " + day);
            }
            days.add(day);
        }

        return days.stream().map(String::valueOf).collect(Collectors.joining(","));
    }

    private static String cronFor(ZonedDateTime at) {
        return String.format("0 %d %d %d %d *", at.getMinute(), at.getHour(), at.getDayOfMonth(), at.getMonthValue());
    }
}
