package com.aigreentick.services.groupcast.campaign.model;

import java.time.LocalDateTime;
import java.util.List;

import com.aigreentick.services.groupcast.campaign.enums.Frequency;
import com.aigreentick.services.groupcast.campaign.enums.ScheduleType;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * When a campaign runs. Which fields apply depends on {@link #type}:
 * <ul>
 *   <li>{@code now}: none</li>
 *   <li>{@code once}: {@link #datetime}, local to the configured timezone</li>
 *   <li>{@code recurring}: {@link #frequency}, {@link #time} (HH:MM) and, for weekly,
 *       {@link #daysOfWeek} (0 = Sunday .. 6 = Saturday)</li>
 * </ul>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScheduleDescriptor {

    private ScheduleType type;

    private LocalDateTime datetime;

    private Frequency frequency;

    private String time;

    private List<Integer> daysOfWeek;

    public static ScheduleDescriptor immediate() {
        return ScheduleDescriptor.builder().type(ScheduleType.IMMEDIATE).build();
    }

    public static ScheduleDescriptor once(LocalDateTime datetime) {
        return ScheduleDescriptor.builder().type(ScheduleType.ONCE).datetime(datetime).build();
    }

    public static ScheduleDescriptor daily(String time) {
        return ScheduleDescriptor.builder()
                .type(ScheduleType.RECURRING)
                .frequency(Frequency.DAILY)
                .time(time)
                .build();
    }

    public static ScheduleDescriptor weekly(String time, List<Integer> daysOfWeek) {
        return ScheduleDescriptor.builder()
                .type(ScheduleType.RECURRING)
                .frequency(Frequency.WEEKLY)
                .time(time)
                .daysOfWeek(daysOfWeek)
                .build();
    }
}
