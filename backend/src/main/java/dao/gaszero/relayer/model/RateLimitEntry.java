package dao.gaszero.relayer.model;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.time.Instant;

@Data
@AllArgsConstructor
public class RateLimitEntry {

    private int count;
    private Instant windowResetAt;
}
