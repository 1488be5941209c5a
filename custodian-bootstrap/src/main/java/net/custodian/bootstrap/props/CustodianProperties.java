package net.custodian.bootstrap.props;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

@ConfigurationProperties("custodian")
public class CustodianProperties {
    private Scheduler scheduler = new Scheduler();
    private Map<String, TaskSettings> tasks = new LinkedHashMap<>(); // taskId → 설정
    private Cache cache = new Cache();
    private RateLimit rateLimit = new RateLimit();
    private Progress progress = new Progress();
    /** 그 밖의 설정 키를 그대로 노출 (SettingsProvider 로 전달) */
    private Map<String, String> settings = new LinkedHashMap<>();

    public Scheduler getScheduler() {
        return scheduler;
    }

    public void setScheduler(Scheduler scheduler) {
        this.scheduler = scheduler;
    }

    public Map<String, TaskSettings> getTasks() {
        return tasks;
    }

    public void setTasks(Map<String, TaskSettings> tasks) {
        this.tasks = tasks;
    }

    public Cache getCache() {
        return cache;
    }

    public void setCache(Cache cache) {
        this.cache = cache;
    }

    public RateLimit getRateLimit() {
        return rateLimit;
    }

    public void setRateLimit(RateLimit rateLimit) {
        this.rateLimit = rateLimit;
    }

    public Progress getProgress() {
        return progress;
    }

    public void setProgress(Progress progress) {
        this.progress = progress;
    }

    public Map<String, String> getSettings() {
        return settings;
    }

    public void setSettings(Map<String, String> settings) {
        this.settings = settings;
    }

    public static class Scheduler {
        private boolean enabled = true;
        private int preferredHour = 2;
        private String zone = "UTC";
        private int poolSize = 2;
        private boolean scheduleOnStartup = true;
        private boolean maintenanceEnabled = true;
        // @Scheduled 에서는 placeholder 로 직접 읽는다. 여기 값은 메타데이터용
        private long maintenanceDelayMs = 3_600_000L;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getPreferredHour() {
            return preferredHour;
        }

        public void setPreferredHour(int preferredHour) {
            this.preferredHour = preferredHour;
        }

        public String getZone() {
            return zone;
        }

        public void setZone(String zone) {
            this.zone = zone;
        }

        public int getPoolSize() {
            return poolSize;
        }

        public void setPoolSize(int poolSize) {
            this.poolSize = poolSize;
        }

        public boolean isScheduleOnStartup() {
            return scheduleOnStartup;
        }

        public void setScheduleOnStartup(boolean scheduleOnStartup) {
            this.scheduleOnStartup = scheduleOnStartup;
        }

        public boolean isMaintenanceEnabled() {
            return maintenanceEnabled;
        }

        public void setMaintenanceEnabled(boolean maintenanceEnabled) {
            this.maintenanceEnabled = maintenanceEnabled;
        }

        public long getMaintenanceDelayMs() {
            return maintenanceDelayMs;
        }

        public void setMaintenanceDelayMs(long maintenanceDelayMs) {
            this.maintenanceDelayMs = maintenanceDelayMs;
        }
    }

    public static class TaskSettings {
        private boolean enabled = true;
        private String frequency;   // null 이면 태스크 기본 주기

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getFrequency() {
            return frequency;
        }

        public void setFrequency(String frequency) {
            this.frequency = frequency;
        }

        @Override
        public String toString() {
            return "TaskSettings{enabled=" + enabled + ", frequency=" + frequency + '}';
        }
    }

    public static class Cache {
        private String prefix = "custodian_";
        private int maxItems = 1000;
        /** CacheManager 빈을 외부 캐시로 사용할지 */
        private boolean useCacheManager = false;
        /** CacheManager 가 프로세스 밖 저장소(Redis 등)인지 */
        private boolean persistent = false;

        public String getPrefix() {
            return prefix;
        }

        public void setPrefix(String prefix) {
            this.prefix = prefix;
        }

        public int getMaxItems() {
            return maxItems;
        }

        public void setMaxItems(int maxItems) {
            this.maxItems = maxItems;
        }

        public boolean isUseCacheManager() {
            return useCacheManager;
        }

        public void setUseCacheManager(boolean useCacheManager) {
            this.useCacheManager = useCacheManager;
        }

        public boolean isPersistent() {
            return persistent;
        }

        public void setPersistent(boolean persistent) {
            this.persistent = persistent;
        }
    }

    public static class RateLimit {
        private int perMinute = 60;
        private Duration lockTtl = Duration.ofSeconds(5);
        private int lockAttempts = 5;
        private Duration lockBackoff = Duration.ofMillis(50);

        public int getPerMinute() {
            return perMinute;
        }

        public void setPerMinute(int perMinute) {
            this.perMinute = perMinute;
        }

        public Duration getLockTtl() {
            return lockTtl;
        }

        public void setLockTtl(Duration lockTtl) {
            this.lockTtl = lockTtl;
        }

        public int getLockAttempts() {
            return lockAttempts;
        }

        public void setLockAttempts(int lockAttempts) {
            this.lockAttempts = lockAttempts;
        }

        public Duration getLockBackoff() {
            return lockBackoff;
        }

        public void setLockBackoff(Duration lockBackoff) {
            this.lockBackoff = lockBackoff;
        }
    }

    public static class Progress {
        /** 이보다 오래된 체크포인트는 maintenance 가 삭제 */
        private Duration staleAfter = Duration.ofDays(1);

        public Duration getStaleAfter() {
            return staleAfter;
        }

        public void setStaleAfter(Duration staleAfter) {
            this.staleAfter = staleAfter;
        }
    }
}
