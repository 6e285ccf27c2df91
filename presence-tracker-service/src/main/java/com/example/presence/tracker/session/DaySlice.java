package com.example.presence.tracker.session;

import java.time.LocalDate;

public record DaySlice(LocalDate date, long seconds) {
}
