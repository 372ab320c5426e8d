package org.agentmarket.simulator.core.population;

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.agentmarket.simulator.config.SimulatorProperties;
import org.agentmarket.simulator.core.sizing.BetSizer;
import org.agentmarket.simulator.core.sizing.FixedFractionSizer;
import org.agentmarket.simulator.core.sizing.KellySizer;
import org.agentmarket.simulator.core.trader.MarketMaker;
import org.agentmarket.simulator.core.trader.MeanReverterTrader;
import org.agentmarket.simulator.core.trader.MomentumTrader;
import org.agentmarket.simulator.core.trader.NoiseTrader;
import org.agentmarket.simulator.core.trader.Trader;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * Builds the initial population from configuration and owns it for the rest of the run.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PopulationManager {
    static final int FIRST_MARKET_MAKER_ID = 100_000;

    private final SimulatorProperties properties;
    private final Random random;
    private Population population;

    @PostConstruct
    public void init() {
        validate();
        SimulatorProperties.Wallet wallet = properties.getWallet();
        double priceStep = properties.getMarket().getPriceStep();
        List<Trader> traders = new ArrayList<>();
        int nextId = 0;

        SimulatorProperties.NoiseGroup noise = properties.getNoise();
        BetSizer noiseSizer = createSizer(noise.getSizer());
        for (int i = 0; i < noise.getCount(); i++) {
            traders.add(new NoiseTrader(nextId++, wallet.getInitialCash(), wallet.getInitialPosition(),
                    noiseSizer, noise.getNoiseWeight(), noise.getHoldProbability(), random));
        }

        SimulatorProperties.MovingAverageGroup reverters = properties.getMeanReverter();
        BetSizer reverterSizer = createSizer(reverters.getSizer());
        for (int i = 0; i < reverters.getCount(); i++) {
            int[] windows = drawWindows(reverters);
            traders.add(new MeanReverterTrader(nextId++, wallet.getInitialCash(), wallet.getInitialPosition(),
                    reverterSizer, windows[0], windows[1], priceStep));
        }

        SimulatorProperties.MovingAverageGroup momentum = properties.getMomentum();
        BetSizer momentumSizer = createSizer(momentum.getSizer());
        for (int i = 0; i < momentum.getCount(); i++) {
            int[] windows = drawWindows(momentum);
            traders.add(new MomentumTrader(nextId++, wallet.getInitialCash(), wallet.getInitialPosition(),
                    momentumSizer, windows[0], windows[1], priceStep));
        }

        Collections.shuffle(traders, random);

        SimulatorProperties.MarketMakerGroup makerConfig = properties.getMarketMaker();
        List<MarketMaker> makers = new ArrayList<>();
        for (int i = 0; i < makerConfig.getCount(); i++) {
            makers.add(new MarketMaker(FIRST_MARKET_MAKER_ID + i, makerConfig.getAnchorPrice(),
                    makerConfig.getSpread() / 2.0, makerConfig.getQuoteSize()));
        }

        population = new Population(traders, makers);
        log.info("Population initialized: noise={}, meanReverters={}, momentum={}, marketMakers={}",
                noise.getCount(), reverters.getCount(), momentum.getCount(), makers.size());
    }

    public Population getPopulation() {
        if (population == null) {
            throw new IllegalStateException("Population is not initialized");
        }
        return population;
    }

    /**
     * Draws short and long windows uniformly from their configured ranges, swapping them when
     * the short draw exceeds the long one.
     */
    private int[] drawWindows(SimulatorProperties.MovingAverageGroup group) {
        int shortWindow = uniform(group.getMinShort(), group.getMaxShort());
        int longWindow = uniform(group.getMinLong(), group.getMaxLong());
        if (shortWindow > longWindow) {
            int tmp = shortWindow;
            shortWindow = longWindow;
            longWindow = tmp;
        }
        return new int[]{shortWindow, longWindow};
    }

    private int uniform(int min, int max) {
        return min + random.nextInt(max - min + 1);
    }

    static BetSizer createSizer(SimulatorProperties.Sizer config) {
        return switch (config.getMethod()) {
            case FIXED_FRACTION -> new FixedFractionSizer(config.getFraction());
            case KELLY -> new KellySizer(config.getFraction(), config.getMinBet());
        };
    }

    private void validate() {
        requireNonNegative("noise.count", properties.getNoise().getCount());
        requireNonNegative("market-maker.count", properties.getMarketMaker().getCount());
        validateGroup("mean-reverter", properties.getMeanReverter());
        validateGroup("momentum", properties.getMomentum());
        double hold = properties.getNoise().getHoldProbability();
        if (hold < 0 || hold > 1) {
            throw new IllegalArgumentException("noise.hold-probability must be within [0, 1]: " + hold);
        }
        if (properties.getMarketMaker().getSpread() < 0) {
            throw new IllegalArgumentException("market-maker.spread must not be negative");
        }
        int traders = properties.getNoise().getCount() + properties.getMeanReverter().getCount()
                + properties.getMomentum().getCount();
        if (traders >= FIRST_MARKET_MAKER_ID) {
            throw new IllegalArgumentException("Too many traders: ids would collide with market maker ids");
        }
    }

    private void validateGroup(String name, SimulatorProperties.MovingAverageGroup group) {
        requireNonNegative(name + ".count", group.getCount());
        if (group.getCount() == 0) {
            return;
        }
        if (group.getMinShort() <= 0 || group.getMinLong() <= 0) {
            throw new IllegalArgumentException(name + " windows must be positive");
        }
        if (group.getMinShort() > group.getMaxShort() || group.getMinLong() > group.getMaxLong()) {
            throw new IllegalArgumentException(name + " window ranges are inverted");
        }
    }

    private static void requireNonNegative(String name, int value) {
        if (value < 0) {
            throw new IllegalArgumentException(name + " must not be negative: " + value);
        }
    }
}
