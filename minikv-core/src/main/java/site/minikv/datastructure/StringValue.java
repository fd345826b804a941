package site.minikv.datastructure;

import lombok.Getter;

/**
 * 字符串值
 *
 * @author minikv
 * @since 1.0.0
 */
public class StringValue implements KvValue {

    @Getter
    private final KvBytes value;

    private long expireAt;

    public StringValue(final KvBytes value) {
        this(value, NO_EXPIRE);
    }

    public StringValue(final KvBytes value, final long expireAt) {
        this.value = value;
        this.expireAt = expireAt;
    }

    @Override
    public long expireAt() {
        return expireAt;
    }

    @Override
    public void setExpireAt(final long expireAt) {
        this.expireAt = expireAt;
    }

    @Override
    public String typeName() {
        return "string";
    }
}
