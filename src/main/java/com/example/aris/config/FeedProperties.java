package com.example.aris.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@ConfigurationProperties(prefix = "feed")
@Validated
public class FeedProperties {

    /** Cache lifetime and periodic refresh interval per user engine. */
    @NotNull
    private Duration cacheTtl = Duration.ofMinutes(5);

    /** Budget for each source's item fetch; unset disables the bound. */
    private Duration itemTimeout = Duration.ofSeconds(5);

    @Valid
    private final Location location = new Location();

    public Duration getCacheTtl() {
        return cacheTtl;
    }

    public void setCacheTtl(Duration cacheTtl) {
        this.cacheTtl = cacheTtl;
    }

    public Duration getItemTimeout() {
        return itemTimeout;
    }

    public void setItemTimeout(Duration itemTimeout) {
        this.itemTimeout = itemTimeout;
    }

    public Location getLocation() {
        return location;
    }

    public static final class Location {
        @Min(1)
        private int historySize = 1;

        public int getHistorySize() {
            return historySize;
        }

        public void setHistorySize(int historySize) {
            this.historySize = historySize;
        }
    }
}
