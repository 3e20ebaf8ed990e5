package discord4j.shards.common.transport;

import reactor.util.annotation.Nullable;

import java.util.Objects;

/**
 * Close code and reason reported when a Gateway socket closes, either from a close frame or synthesized locally.
 */
public final class CloseStatus {

    public static final CloseStatus NORMAL_CLOSE = new CloseStatus(1000, "Normal closure");
    public static final CloseStatus GOING_AWAY = new CloseStatus(1001, "Going away");
    public static final CloseStatus ABNORMAL_CLOSE = new CloseStatus(1006, "Abnormal closure");

    private final int code;
    @Nullable
    private final String reason;

    public CloseStatus(int code, @Nullable String reason) {
        this.code = code;
        this.reason = reason;
    }

    public int getCode() {
        return code;
    }

    @Nullable
    public String getReason() {
        return reason;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        CloseStatus that = (CloseStatus) o;
        return code == that.code && Objects.equals(reason, that.reason);
    }

    @Override
    public int hashCode() {
        return Objects.hash(code, reason);
    }

    @Override
    public String toString() {
        return "CloseStatus{" +
                "code=" + code +
                ", reason='" + reason + '\'' +
                '}';
    }
}
