package my.wealthtracker.app.model;

import java.math.BigDecimal;
import java.time.LocalDate;

public record Milestone(String name, BigDecimal targetAmount, LocalDate targetDate) {
}
