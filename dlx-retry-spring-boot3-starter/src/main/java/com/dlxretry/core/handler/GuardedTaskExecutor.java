package com.dlxretry.core.handler;

import com.dlxretry.config.DlxGuardProperties;
import com.dlxretry.core.spi.TaskHandler;
import com.dlxretry.exception.guard.DownstreamBulkheadFullException;
import com.dlxretry.exception.guard.DownstreamOpenCircuitException;
import com.dlxretry.exception.guard.DownstreamRateLimitedException;
import com.dlxretry.model.ctx.DeliveryContext;
import io.github.resilience4j.bulkhead.Bulkhead;
import io.github.resilience4j.bulkhead.BulkheadConfig;
import io.github.resilience4j.bulkhead.BulkheadFullException;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import io.github.resilience4j.ratelimiter.RequestNotPermitted;

import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Predicate;

/**
 * 按队列为任务执行加上 RL/BH/CB 保护
 * 被拒绝的调用转成 Downstream* 异常, 与普通任务失败一样进入死信重试
 */
public class GuardedTaskExecutor {

    private final DlxGuardProperties props;

    private final ConcurrentHashMap<String, CircuitBreaker> cbCache = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Bulkhead>      bhCache = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, RateLimiter>   rlCache = new ConcurrentHashMap<>();

    public GuardedTaskExecutor(DlxGuardProperties props) {
        this.props = props;
    }

    /** 不做任何保护 */
    public static GuardedTaskExecutor passThrough() {
        DlxGuardProperties p = new DlxGuardProperties();
        p.setEnabled(false);
        return new GuardedTaskExecutor(p);
    }

    /**
     * 统一入口
     * 对 handler.execute(ctx, payload) 增加 CB/BH/RL 装饰后执行
     */
    public <T> boolean execute(String queue, DeliveryContext ctx,
                               T payload, TaskHandler<T> handler) throws Exception {
        Callable<Boolean> decorated = () -> handler.execute(ctx, payload);
        if (!props.isEnabled()) {
            return decorated.call();
        }

        // 组合装饰 RateLimiter → Bulkhead → CircuitBreaker
        if (enabled(props.getRateLimiter(), props.getRlPerQueue(), queue, DlxGuardProperties.RlConfig::isEnabled)) {
            RateLimiter rl = rlCache.computeIfAbsent(queue, this::buildRl);
            decorated = RateLimiter.decorateCallable(rl, decorated);
        }
        if (enabled(props.getBulkhead(), props.getBhPerQueue(), queue, DlxGuardProperties.BhConfig::isEnabled)) {
            Bulkhead bh = bhCache.computeIfAbsent(queue, this::buildBh);
            decorated = Bulkhead.decorateCallable(bh, decorated);
        }
        if (enabled(props.getCircuitBreaker(), props.getCbPerQueue(), queue, DlxGuardProperties.CbConfig::isEnabled)) {
            CircuitBreaker cb = cbCache.computeIfAbsent(queue, this::buildCb);
            decorated = CircuitBreaker.decorateCallable(cb, decorated);
        }

        try {
            return decorated.call();
        } catch (CallNotPermittedException open) {
            throw new DownstreamOpenCircuitException(open);
        } catch (BulkheadFullException full) {
            throw new DownstreamBulkheadFullException(full);
        } catch (RequestNotPermitted rnp) {
            throw new DownstreamRateLimitedException(rnp);
        }
    }

    private RateLimiter buildRl(String queue) {
        DlxGuardProperties.RlConfig r = pick(props.getRlPerQueue(), queue, props.getRateLimiter());
        RateLimiterConfig cfg = RateLimiterConfig.custom()
                .limitForPeriod(r.getLimitForPeriod())
                .limitRefreshPeriod(r.getLimitRefreshPeriod())
                .timeoutDuration(r.getTimeoutDuration())
                .build();
        return RateLimiter.of("rl:" + queue, cfg);
    }

    private Bulkhead buildBh(String queue) {
        DlxGuardProperties.BhConfig b = pick(props.getBhPerQueue(), queue, props.getBulkhead());
        BulkheadConfig cfg = BulkheadConfig.custom()
                .maxConcurrentCalls(b.getMaxConcurrentCalls())
                .maxWaitDuration(b.getMaxWaitDuration())
                .fairCallHandlingStrategyEnabled(true)
                .build();
        return Bulkhead.of("bh:" + queue, cfg);
    }

    private CircuitBreaker buildCb(String queue) {
        DlxGuardProperties.CbConfig c = pick(props.getCbPerQueue(), queue, props.getCircuitBreaker());
        CircuitBreakerConfig cfg = CircuitBreakerConfig.custom()
                .failureRateThreshold(c.getFailureRateThreshold())
                .slowCallRateThreshold(c.getSlowCallRateThreshold())
                .slowCallDurationThreshold(c.getSlowCallDurationThreshold())
                .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.COUNT_BASED)
                .slidingWindowSize(c.getSlidingWindowSize())
                .waitDurationInOpenState(c.getWaitDurationInOpenState())
                .permittedNumberOfCallsInHalfOpenState(c.getPermittedNumberOfCallsInHalfOpenState())
                .recordExceptions(Throwable.class)
                .build();
        return CircuitBreaker.of("cb:" + queue, cfg);
    }

    private static <C> C pick(Map<String, C> perQueue, String queue, C def) {
        if (perQueue == null) {
            return def;
        }
        C c = perQueue.get(queue);
        return c == null ? def : c;
    }

    private static <C> boolean enabled(C defaultCfg, Map<String, C> perQueue, String queue, Predicate<C> flag) {
        if (defaultCfg == null) {
            return false;
        }
        return flag.test(pick(perQueue, queue, defaultCfg));
    }

    public CircuitBreaker getCircuitBreakerIfEnabled(String queue) {
        if (!props.isEnabled()
                || !enabled(props.getCircuitBreaker(), props.getCbPerQueue(), queue, DlxGuardProperties.CbConfig::isEnabled)) {
            return null;
        }
        return cbCache.computeIfAbsent(queue, this::buildCb);
    }
}
