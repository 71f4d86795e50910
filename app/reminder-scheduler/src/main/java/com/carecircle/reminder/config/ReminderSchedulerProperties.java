/*
 * どこで: Reminder Scheduler の設定バインド
 * 何を: sweep 間隔、各ドメインのリマインダーオフセット、先読み幅を保持する
 * なぜ: 運用パラメータを外部化し、起動時に不正値を検知するため
 */
package com.carecircle.reminder.config;

import com.carecircle.reminder.model.AppointmentStatus;
import com.carecircle.reminder.model.FamilyRole;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import java.time.Duration;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "reminder.scheduler")
public record ReminderSchedulerProperties(
    boolean enabled,
    @NotNull Duration interval,
    @NotNull Duration missedTickTolerance,
    @NotNull List<@NotNull @PositiveOrZero Integer> medicationOffsets,
    @NotNull List<@NotNull @PositiveOrZero Integer> appointmentOffsets,
    @NotNull List<@NotNull @PositiveOrZero Integer> shiftOffsets,
    @NotNull Duration lookaheadBuffer,
    @NotEmpty List<AppointmentStatus> appointmentStatuses,
    @NotEmpty List<FamilyRole> refillRecipientRoles,
    @Positive int workerThreads) {}
