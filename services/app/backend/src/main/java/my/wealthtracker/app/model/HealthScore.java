package my.wealthtracker.app.model;

import java.util.List;
import java.util.Map;

public record HealthScore(int overallScore,
						  String rating,
						  Map<String, Integer> categoryScores,
						  Map<String, String> explanations,
						  List<String> recommendations,
						  List<String> strengths) {
}
