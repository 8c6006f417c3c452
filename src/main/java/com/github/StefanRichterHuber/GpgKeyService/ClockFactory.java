package com.github.StefanRichterHuber.GpgKeyService;

import java.time.Clock;

import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;

/**
 * Factory for the clock used to stamp the ingestion time of keys.
 */
public class ClockFactory {

    @Produces
    @Singleton
    Clock createClock() {
        return Clock.systemUTC();
    }
}
