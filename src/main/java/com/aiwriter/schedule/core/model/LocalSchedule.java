package com.aiwriter.schedule.core.model;

import java.time.DateTimeException;
import java.time.LocalDateTime;

/**
 * =====================================================================
 * LocalSchedule
 * =====================================================================
 *
 * PURPOSE ------- The naive wall-clock tuple a user picks when scheduling
 * content. No timezone is carried; the compiling step interprets the fields in
 * the zone of the process evaluating them.
 *
 * VALIDATION ---------- The six fields must denote a real calendar date/time.
 * Construction fails for impossible combinations (e.g. day 31 of a 30-day
 * month, February 29 of a non-leap year) instead of rolling over into the next
 * month.
 *
 * IMMUTABILITY ------------ Java record, safe to share across threads.
 */
public record LocalSchedule(int year, int month, int day, int hour, int minute, int second) {

	public LocalSchedule {
		try {
			LocalDateTime.of(year, month, day, hour, minute, second);
		} catch (DateTimeException e) {
			throw new IllegalArgumentException("schedule " + describe(year, month, day, hour, minute, second)
					+ " is not a valid calendar date/time: " + e.getMessage(), e);
		}
	}

	public static LocalSchedule of(LocalDateTime dateTime) {
		return new LocalSchedule(dateTime.getYear(), dateTime.getMonthValue(), dateTime.getDayOfMonth(),
				dateTime.getHour(), dateTime.getMinute(), dateTime.getSecond());
	}

	public LocalDateTime toLocalDateTime() {
		return LocalDateTime.of(year, month, day, hour, minute, second);
	}

	@Override
	public String toString() {
		return describe(year, month, day, hour, minute, second);
	}

	private static String describe(int year, int month, int day, int hour, int minute, int second) {
		return String.format("%04d-%02d-%02dT%02d:%02d:%02d", year, month, day, hour, minute, second);
	}
}
