package com.github.salilvnair.convflow.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Component
@ConfigurationProperties(prefix = "convflow")
@Getter
@Setter
public class ConvFlowProperties {

    private Stack stack = new Stack();
    private Transfer transfer = new Transfer();
    private Inheritance inheritance = new Inheritance();
    private Cache cache = new Cache();

    @Getter
    @Setter
    public static class Stack {
        private int maxDepth = 5;
        private Duration frameTtl = Duration.ofHours(24);
        private Duration storeTtl = Duration.ofSeconds(3600);
        private Sweep sweep = new Sweep();
    }

    @Getter
    @Setter
    public static class Sweep {
        private boolean enabled = false;
        private long intervalMs = 60_000L;
    }

    @Getter
    @Setter
    public static class Transfer {
        private Duration sessionTimeout = Duration.ofMinutes(30);
        private Duration activityTtl = Duration.ofSeconds(3600);
        private int errorThreshold = 3;
        private String errorCountKey = "error_count";
        private Duration classifierTimeout = Duration.ofSeconds(2);
        private boolean loadDefaultRules = true;
        private int historyLimit = 50;
        private Duration historyTtl = Duration.ofHours(24);
        private List<String> exitPatterns = new ArrayList<>(List.of(
                "退出", "结束", "不要了", "算了", "\\bexit\\b", "\\bquit\\b", "\\bstop\\b"));
        private List<String> backPatterns = new ArrayList<>(List.of(
                "返回", "回去", "\\bgo back\\b"));
    }

    @Getter
    @Setter
    public static class Inheritance {
        private int historyLimit = 10;
        private Duration sourceTimeout = Duration.ofSeconds(2);
        private boolean loadDefaultRules = true;
    }

    @Getter
    @Setter
    public static class Cache {
        private boolean enabled = true;
        private Duration defaultTtl = Duration.ofSeconds(1800);
        private int trackedCombinationsPerUser = 10;
    }
}
