package com.ryuqq.finfind.core.workflow;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 실행 중인 워크플로를 취소하는 신호.
 *
 * <p>취소되면 등록된 리스너가 한 번씩 호출됩니다. 취소 이후에 등록된 리스너는 즉시 호출됩니다.
 * 등록과 취소가 동시에 일어나면 리스너가 두 번 호출될 수 있으므로 리스너는 멱등이어야 합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class CancellationSignal {

    private final AtomicReference<String> reason = new AtomicReference<>();
    private final List<Runnable> listeners = new CopyOnWriteArrayList<>();

    /**
     * 새 신호 생성.
     *
     * @return 취소되지 않은 신호
     */
    public static CancellationSignal create() {
        return new CancellationSignal();
    }

    /**
     * 취소.
     *
     * @param why 취소 사유
     * @return 이번 호출로 취소되었으면 true, 이미 취소된 상태면 false
     */
    public boolean cancel(String why) {
        if (!reason.compareAndSet(null, why == null ? "cancelled" : why)) {
            return false;
        }
        for (Runnable listener : listeners) {
            listener.run();
        }
        return true;
    }

    public boolean isCancelled() {
        return reason.get() != null;
    }

    /**
     * 취소 사유.
     *
     * @return 사유 (취소되지 않았으면 null)
     */
    public String reason() {
        return reason.get();
    }

    /**
     * 취소 리스너 등록.
     *
     * @param listener 취소 시 실행할 작업
     * @return 등록 해제 핸들
     */
    public Registration onCancel(Runnable listener) {
        if (listener == null) {
            throw new IllegalArgumentException("listener cannot be null");
        }
        listeners.add(listener);
        if (isCancelled()) {
            listener.run();
        }
        return () -> listeners.remove(listener);
    }

    /**
     * 리스너 등록 해제 핸들.
     */
    @FunctionalInterface
    public interface Registration {
        void remove();
    }
}
