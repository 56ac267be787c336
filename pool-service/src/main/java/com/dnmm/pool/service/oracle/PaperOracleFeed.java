package com.dnmm.pool.service.oracle;

import com.dnmm.pool.math.BpsMath;
import com.dnmm.pool.oracle.OracleAdapter;
import jakarta.annotation.PostConstruct;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.util.concurrent.atomic.AtomicReference;

/**
 * In-process oracle for local runs and demos. Prices are pushed through {@code /api/oracle}; ages are derived from
 * the publish time, which callers may backdate to exercise staleness handling.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PaperOracleFeed implements OracleAdapter {

  private static final BigDecimal TWO = BigDecimal.valueOf(2);

  private final @NonNull PaperOracleProperties properties;
  private final @NonNull Clock clock;

  private final AtomicReference<Primary> primary = new AtomicReference<>();
  private final AtomicReference<BigDecimal> ema = new AtomicReference<>();
  private final AtomicReference<Secondary> secondary = new AtomicReference<>();

  @PostConstruct
  void seed() {
    BigDecimal mid = properties.initialMid();
    publishPrimary(mid, properties.initialSpreadBps(), 0);
    publishEma(mid);
    if (Boolean.TRUE.equals(properties.secondaryEnabled())) {
      publishSecondary(mid, properties.initialSecondaryConfBps(), 0);
    }
    log.info("paper oracle seeded (mid={}, spreadBps={}, secondaryEnabled={})",
        mid, properties.initialSpreadBps(), properties.secondaryEnabled());
  }

  public void publishPrimary(@NonNull BigDecimal mid, int spreadBps, long ageSec) {
    BigDecimal halfSpread = BpsMath.applyBps(mid, Math.max(0, spreadBps)).divide(TWO, BpsMath.CTX);
    primary.set(new Primary(mid, mid.subtract(halfSpread), mid.add(halfSpread), nowSec() - Math.max(0, ageSec)));
    log.debug("paper primary published mid={} spreadBps={} ageSec={}", mid, spreadBps, ageSec);
  }

  public void withdrawPrimary() {
    primary.set(null);
  }

  public void publishEma(BigDecimal mid) {
    ema.set(mid);
  }

  public void publishSecondary(@NonNull BigDecimal mid, int confBps, long ageSec) {
    secondary.set(new Secondary(mid, Math.max(0, confBps), nowSec() - Math.max(0, ageSec)));
    log.debug("paper secondary published mid={} confBps={} ageSec={}", mid, confBps, ageSec);
  }

  public void withdrawSecondary() {
    secondary.set(null);
  }

  public FeedView view() {
    long now = nowSec();
    Primary p = primary.get();
    Secondary s = secondary.get();
    return new FeedView(
        p == null ? null : p.mid(),
        p == null ? null : p.bid().setScale(8, RoundingMode.DOWN),
        p == null ? null : p.ask().setScale(8, RoundingMode.UP),
        p == null ? null : now - p.publishedAt(),
        ema.get(),
        s == null ? null : s.mid(),
        s == null ? null : s.confBps(),
        s == null ? null : now - s.publishedAt()
    );
  }

  @Override
  public MidAndAge readMidAndAge() {
    Primary p = primary.get();
    if (p == null) {
      return MidAndAge.missing();
    }
    return new MidAndAge(p.mid(), nowSec() - p.publishedAt(), true);
  }

  @Override
  public BidAsk readBidAsk() {
    Primary p = primary.get();
    if (p == null) {
      return BidAsk.missing();
    }
    return new BidAsk(p.bid(), p.ask(), true);
  }

  @Override
  public EmaMid readEmaFallback() {
    BigDecimal mid = ema.get();
    return mid == null ? EmaMid.missing() : new EmaMid(mid, true);
  }

  @Override
  public SecondaryMid readSecondaryMid() {
    Secondary s = secondary.get();
    if (s == null) {
      return SecondaryMid.missing();
    }
    return new SecondaryMid(s.mid(), s.confBps(), nowSec() - s.publishedAt(), true);
  }

  private long nowSec() {
    return clock.millis() / 1000L;
  }

  public record FeedView(
      BigDecimal primaryMid,
      BigDecimal primaryBid,
      BigDecimal primaryAsk,
      Long primaryAgeSec,
      BigDecimal emaMid,
      BigDecimal secondaryMid,
      Integer secondaryConfBps,
      Long secondaryAgeSec
  ) {
  }

  private record Primary(BigDecimal mid, BigDecimal bid, BigDecimal ask, long publishedAt) {
  }

  private record Secondary(BigDecimal mid, int confBps, long publishedAt) {
  }
}
