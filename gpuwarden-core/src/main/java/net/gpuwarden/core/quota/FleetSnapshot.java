package net.gpuwarden.core.quota;

/**
 * 평가 대상 워커를 제외한, 같은 프로바이더의 살아있는 점유 수.
 * 예약 1단계에서 프로바이더 락을 잡은 상태로 만든다.
 */
public record FleetSnapshot(int otherActiveSessions, int otherLiveWorkers, int otherReservationsInFlight) {

    public static final FleetSnapshot EMPTY = new FleetSnapshot(0, 0, 0);

    /** 세션/워커/예약 중 가장 큰 점유 수 (같은 점유가 중복 집계되지 않도록) */
    public int occupied() {
        return Math.max(otherActiveSessions, otherLiveWorkers + otherReservationsInFlight);
    }
}
