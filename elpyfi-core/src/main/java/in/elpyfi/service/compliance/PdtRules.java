package in.elpyfi.service.compliance;

/**
 * Weekly day-trade budget.
 * Ordinary admissions may use weeklyLimit - emergencyReserve slots; the reserve
 * is kept for loss-cutting exits.
 */
public record PdtRules(int weeklyLimit, int emergencyReserve) {
    public static final int DEFAULT_WEEKLY_LIMIT = 3;
    public static final int DEFAULT_EMERGENCY_RESERVE = 1;

    public PdtRules {
        if (weeklyLimit <= 0) {
            throw new IllegalArgumentException("Weekly limit must be positive: " + weeklyLimit);
        }
        if (emergencyReserve < 0 || emergencyReserve > weeklyLimit) {
            throw new IllegalArgumentException(
                "Emergency reserve must be within 0.." + weeklyLimit + ": " + emergencyReserve);
        }
    }

    public static PdtRules defaults() {
        return new PdtRules(DEFAULT_WEEKLY_LIMIT, DEFAULT_EMERGENCY_RESERVE);
    }

    public int ordinaryCapacity() {
        return weeklyLimit - emergencyReserve;
    }
}
