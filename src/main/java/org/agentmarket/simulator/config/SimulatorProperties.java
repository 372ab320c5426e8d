package org.agentmarket.simulator.config;

import lombok.Data;
import org.agentmarket.simulator.core.sizing.SizingMethod;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "simulator")
public class SimulatorProperties {
    /**
     * Seed of the shared random generator. Null means an entropy-seeded generator.
     */
    private Long seed;
    private Market market = new Market();
    private Evolution evolution = new Evolution();
    private Wallet wallet = new Wallet();
    private NoiseGroup noise = new NoiseGroup();
    private MovingAverageGroup meanReverter = new MovingAverageGroup();
    private MovingAverageGroup momentum = new MovingAverageGroup();
    private MarketMakerGroup marketMaker = new MarketMakerGroup();
    private Run run = new Run();
    private Logging logging = new Logging();

    @Data
    public static class Market {
        private double initialPrice = 100.0;
        private int maxOrderAge = 50;
        private double priceStep = 0.01;
        private int tickHistoryLimit = 10000;
        private int tradeLogFlushInterval = 1000;
    }

    @Data
    public static class Evolution {
        private boolean enabled = true;
        private int intervalTicks = 500;
        private double killPercentage = 0.1;
    }

    @Data
    public static class Wallet {
        private double initialCash = 100000;
        private double initialPosition = 10;
    }

    @Data
    public static class Sizer {
        private SizingMethod method = SizingMethod.FIXED_FRACTION;
        private double fraction = 0.01;
        private double minBet = 1.0;
    }

    @Data
    public static class NoiseGroup {
        private int count;
        private double noiseWeight = 0.01;
        private double holdProbability = 0.0;
        private Sizer sizer = new Sizer();
    }

    @Data
    public static class MovingAverageGroup {
        private int count;
        private int minShort = 5;
        private int maxShort = 20;
        private int minLong = 50;
        private int maxLong = 200;
        private Sizer sizer = new Sizer();
    }

    @Data
    public static class MarketMakerGroup {
        private int count;
        private double anchorPrice = 100.0;
        private double spread = 0.5;
        private double quoteSize = 10.0;
    }

    @Data
    public static class Run {
        private int totalTicks = 0;
        private int standingsLimit = 20;
    }

    @Data
    public static class Logging {
        private String directory = "logs";
        private int maxSessionFiles = 50;
    }
}
