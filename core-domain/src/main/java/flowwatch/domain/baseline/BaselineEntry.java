package flowwatch.domain.baseline;

/**
 * Par (día del año, P90) del baseline histórico de una estación.
 */
public record BaselineEntry(int dayOfYear, double p90Flow) {

    public BaselineEntry {
        if (dayOfYear < 1 || dayOfYear > 366) {
            throw new IllegalArgumentException("dayOfYear out of range [1, 366]: " + dayOfYear);
        }
    }
}
