package com.retail.storeintel.dto;

import com.retail.storeintel.entity.DayPeriod;

import java.time.DayOfWeek;

public record PeakBucket(DayOfWeek dayOfWeek, DayPeriod period, double meanValue) {}
