package com.donorid.model.window;

import java.time.LocalDateTime;

/**
 * Canonical death time of one hospitalization and the windows derived from it.
 *
 * @param deathTime canonical death timestamp
 * @param imv       lookback for invasive ventilation
 * @param culture   lookback for positive blood cultures
 * @param lifetime  whole stay, used for diagnoses and organ quality labs
 */
public record ResolvedWindows(
    LocalDateTime deathTime,
    TimeWindow imv,
    TimeWindow culture,
    TimeWindow lifetime
) {}
