package com.convoagent.domain.trace.service;

/**
 * 自动关闭的 span 作用域。未采样时为共享的空实现。
 */
public interface SpanScope extends AutoCloseable {

    SpanScope NOOP = new SpanScope() {
        @Override
        public String spanId() {
            return null;
        }

        @Override
        public SpanScope attribute(String key, Object value) {
            return this;
        }

        @Override
        public void markError(Throwable error) {
        }

        @Override
        public void markError(String message) {
        }

        @Override
        public void close() {
        }
    };

    String spanId();

    SpanScope attribute(String key, Object value);

    void markError(Throwable error);

    void markError(String message);

    @Override
    void close();
}
