package com.dlxretry.core.spi.outcome;

import com.dlxretry.core.inspect.Inspection;
import com.dlxretry.model.ctx.DeliveryContext;
import com.dlxretry.model.enums.DeliveryState;
import com.dlxretry.model.enums.FailureCategory;
import lombok.Getter;

/**
 * 结算判定器 根据执行结果与死信历史给出结算方式
 */
public interface OutcomeDecider {

    /**
     * @param failure    执行失败原因, 成功为 null
     * @param inspection 本次投递的死信历史判定
     */
    Decision decide(Throwable failure, Inspection inspection, DeliveryContext ctx);

    @Getter
    final class Decision {
        private final DeliveryState state;
        private final FailureCategory category;
        private final boolean malformed;
        private final String code;
        private final String message;

        private Decision(DeliveryState s, FailureCategory c, boolean m, String code, String msg) {
            this.state = s; this.category = c; this.malformed = m; this.code = code; this.message = msg;
        }
        public static Decision of(DeliveryState s, FailureCategory c) { return new Decision(s, c, false, null, null); }
        public Decision malformed(boolean m){ return new Decision(state, category, m, code, message); }
        public Decision withCode(String code){ return new Decision(state, category, malformed, code, message); }
        public Decision withMsg(String msg){ return new Decision(state, category, malformed, code, msg); }

        @Override
        public String toString() {
            return "Decision{" + state + ", category=" + category + ", code=" + code + ", malformed=" + malformed + "}";
        }
    }
}
