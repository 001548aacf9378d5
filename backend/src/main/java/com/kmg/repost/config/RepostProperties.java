package com.kmg.repost.config;

import com.kmg.repost.service.JitterPolicy;
import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Validated
@ConfigurationProperties(prefix = "repost")
public class RepostProperties {
    @NotBlank
    private String baseDir;
    @Valid
    @NotNull
    private State state = new State();
    @Valid
    @NotNull
    private Scheduler scheduler = new Scheduler();
    @Valid
    @NotNull
    private Defaults defaults = new Defaults();
    @Valid
    @NotNull
    private Target target = new Target();
    @Valid
    @NotNull
    private Action action = new Action();
    @NotNull
    private Dashboard dashboard = new Dashboard();

    public String getBaseDir() {
        return baseDir;
    }

    public void setBaseDir(String baseDir) {
        this.baseDir = baseDir;
    }

    public State getState() {
        return state;
    }

    public void setState(State state) {
        this.state = state;
    }

    public Scheduler getScheduler() {
        return scheduler;
    }

    public void setScheduler(Scheduler scheduler) {
        this.scheduler = scheduler;
    }

    public Defaults getDefaults() {
        return defaults;
    }

    public void setDefaults(Defaults defaults) {
        this.defaults = defaults;
    }

    public Target getTarget() {
        return target;
    }

    public void setTarget(Target target) {
        this.target = target;
    }

    public Action getAction() {
        return action;
    }

    public void setAction(Action action) {
        this.action = action;
    }

    public Dashboard getDashboard() {
        return dashboard;
    }

    public void setDashboard(Dashboard dashboard) {
        this.dashboard = dashboard;
    }

    public Path baseDirPath() {
        return Path.of(baseDir);
    }

    public static class State {
        @NotBlank
        private String dbPath;

        public String getDbPath() {
            return dbPath;
        }

        public void setDbPath(String dbPath) {
            this.dbPath = dbPath;
        }
    }

    public static class Scheduler {
        private boolean enabled = true;
        @NotNull
        private Duration tickInterval = Duration.ofMinutes(2);
        @NotNull
        private Duration initialDelay = Duration.ofSeconds(30);

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public Duration getTickInterval() {
            return tickInterval;
        }

        public void setTickInterval(Duration tickInterval) {
            this.tickInterval = tickInterval;
        }

        public Duration getInitialDelay() {
            return initialDelay;
        }

        public void setInitialDelay(Duration initialDelay) {
            this.initialDelay = initialDelay;
        }
    }

    public static class Defaults {
        private double periodHours = 48;
        @Min(0)
        private int jitterMinutes = 7;
        private double minPeriodHours = 1;

        @AssertTrue(message = "period-hours and min-period-hours must be between one minute and "
                + JitterPolicy.MAX_PERIOD_HOURS + " hours")
        public boolean isWithinSchedulableRange() {
            return isSchedulable(periodHours) && isSchedulable(minPeriodHours);
        }

        private static boolean isSchedulable(double hours) {
            // 1.0 / 60 must pass despite rounding.
            return hours * 60 >= 1 - 1e-9 && hours <= JitterPolicy.MAX_PERIOD_HOURS;
        }

        public double getPeriodHours() {
            return periodHours;
        }

        public void setPeriodHours(double periodHours) {
            this.periodHours = periodHours;
        }

        public int getJitterMinutes() {
            return jitterMinutes;
        }

        public void setJitterMinutes(int jitterMinutes) {
            this.jitterMinutes = jitterMinutes;
        }

        public double getMinPeriodHours() {
            return minPeriodHours;
        }

        public void setMinPeriodHours(double minPeriodHours) {
            this.minPeriodHours = minPeriodHours;
        }
    }

    public static class Target {
        @NotBlank
        private String urlPattern = "^https://www\\.leboncoin\\.fr/.*";

        public String getUrlPattern() {
            return urlPattern;
        }

        public void setUrlPattern(String urlPattern) {
            this.urlPattern = urlPattern;
        }
    }

    public static class Action {
        private String email;
        private String password;
        private boolean headless = true;
        @NotBlank
        private String homeUrl = "https://www.leboncoin.fr/";
        @NotBlank
        private String loginUrl = "https://www.leboncoin.fr/compte/part/Login";
        private String sessionStatePath;
        @NotEmpty
        private List<String> buttonLabels = new ArrayList<>(List.of(
                "Renouveler", "Reposter", "Remonter", "Relancer", "Remise en avant", "Remonter l'annonce"
        ));
        @NotNull
        private Duration cookieBannerTimeout = Duration.ofSeconds(3);
        @NotNull
        private Duration loginSettle = Duration.ofSeconds(3);
        @NotNull
        private Duration pageSettle = Duration.ofSeconds(2);
        @NotNull
        private Duration confirmSettle = Duration.ofMillis(1500);
        @NotNull
        private Duration finalSettle = Duration.ofMillis(2500);

        public String getEmail() {
            return email;
        }

        public void setEmail(String email) {
            this.email = email;
        }

        public String getPassword() {
            return password;
        }

        public void setPassword(String password) {
            this.password = password;
        }

        public boolean isHeadless() {
            return headless;
        }

        public void setHeadless(boolean headless) {
            this.headless = headless;
        }

        public String getHomeUrl() {
            return homeUrl;
        }

        public void setHomeUrl(String homeUrl) {
            this.homeUrl = homeUrl;
        }

        public String getLoginUrl() {
            return loginUrl;
        }

        public void setLoginUrl(String loginUrl) {
            this.loginUrl = loginUrl;
        }

        public String getSessionStatePath() {
            return sessionStatePath;
        }

        public void setSessionStatePath(String sessionStatePath) {
            this.sessionStatePath = sessionStatePath;
        }

        public List<String> getButtonLabels() {
            return buttonLabels;
        }

        public void setButtonLabels(List<String> buttonLabels) {
            this.buttonLabels = buttonLabels;
        }

        public Duration getCookieBannerTimeout() {
            return cookieBannerTimeout;
        }

        public void setCookieBannerTimeout(Duration cookieBannerTimeout) {
            this.cookieBannerTimeout = cookieBannerTimeout;
        }

        public Duration getLoginSettle() {
            return loginSettle;
        }

        public void setLoginSettle(Duration loginSettle) {
            this.loginSettle = loginSettle;
        }

        public Duration getPageSettle() {
            return pageSettle;
        }

        public void setPageSettle(Duration pageSettle) {
            this.pageSettle = pageSettle;
        }

        public Duration getConfirmSettle() {
            return confirmSettle;
        }

        public void setConfirmSettle(Duration confirmSettle) {
            this.confirmSettle = confirmSettle;
        }

        public Duration getFinalSettle() {
            return finalSettle;
        }

        public void setFinalSettle(Duration finalSettle) {
            this.finalSettle = finalSettle;
        }
    }

    /**
     * Basic-auth credentials guarding {@code /api/**}. Left blank, every API request is refused.
     */
    public static class Dashboard {
        private String user;
        private String password;

        public String getUser() {
            return user;
        }

        public void setUser(String user) {
            this.user = user;
        }

        public String getPassword() {
            return password;
        }

        public void setPassword(String password) {
            this.password = password;
        }

        public boolean hasCredentials() {
            return user != null && !user.isBlank() && password != null && !password.isEmpty();
        }
    }
}
