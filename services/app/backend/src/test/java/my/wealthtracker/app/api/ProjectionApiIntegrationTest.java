package my.wealthtracker.app.api;

import my.wealthtracker.app.WealthTrackerApplication;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.springframework.web.context.WebApplicationContext;

import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest(classes = WealthTrackerApplication.class)
@ActiveProfiles("test")
class ProjectionApiIntegrationTest {
	private MockMvc mockMvc;

	@Autowired
	private WebApplicationContext context;

	@BeforeEach
	void setUp() {
		mockMvc = MockMvcBuilders.webAppContextSetup(context).build();
	}

	@Test
	void aggregatesCategoryProjections() throws Exception {
		String payload = """
				[
				  { "category": "equities", "currentValue": 1000, "annualGrowthRatePct": 0, "horizonYears": 3 },
				  { "category": "fixed_deposits", "currentValue": 500, "annualGrowthRatePct": 0,
				    "annualLumpsum": 100, "horizonYears": 3 }
				]
				""";

		mockMvc.perform(post("/api/projections/calculate")
						.contentType("application/json")
						.content(payload))
				.andExpect(status().isOk())
				.andExpect(jsonPath("$", hasSize(3)))
				.andExpect(jsonPath("$[0].year").value(1))
				.andExpect(jsonPath("$[0].totalValue").value(1600.0))
				.andExpect(jsonPath("$[2].year").value(3))
				.andExpect(jsonPath("$[2].lumpsumValue").value(1800.0))
				.andExpect(jsonPath("$[2].contributionValue").value(0.0));
	}

	@Test
	void rejectsEmptyRequestList() throws Exception {
		mockMvc.perform(post("/api/projections/calculate")
						.contentType("application/json")
						.content("[]"))
				.andExpect(status().isBadRequest())
				.andExpect(jsonPath("$.field").value("requests"));
	}

	@Test
	void mismatchedHorizonsAreAConfigurationError() throws Exception {
		String payload = """
				[
				  { "category": "equities", "currentValue": 1000, "annualGrowthRatePct": 5, "horizonYears": 3 },
				  { "category": "other", "currentValue": 500, "annualGrowthRatePct": 5, "horizonYears": 4 }
				]
				""";

		mockMvc.perform(post("/api/projections/calculate")
						.contentType("application/json")
						.content(payload))
				.andExpect(status().is(422));
	}

	@Test
	void horizonOutOfRangeIsRejected() throws Exception {
		String payload = """
				[ { "category": "equities", "currentValue": 1000, "annualGrowthRatePct": 5, "horizonYears": 51 } ]
				""";

		mockMvc.perform(post("/api/projections/calculate")
						.contentType("application/json")
						.content(payload))
				.andExpect(status().isBadRequest())
				.andExpect(jsonPath("$.field").value("horizonYears"));
	}

	@Test
	void projectsSnapshotWithDefaultAssumptions() throws Exception {
		String payload = """
				{
				  "snapshot": {
				    "valuationDate": "2025-06-30",
				    "holdings": [
				      { "id": "h1", "name": "Index Fund", "category": "mutual_funds", "costBasis": 80000,
				        "currentValue": 100000, "acquisitionDate": "2022-01-01",
				        "contributionSchedule": { "monthlyAmount": 5000, "stepUpPct": 10, "active": true } }
				    ]
				  },
				  "growthRates": { "pooled-funds": 0 },
				  "years": 2
				}
				""";

		mockMvc.perform(post("/api/projections/snapshot")
						.contentType("application/json")
						.content(payload))
				.andExpect(status().isOk())
				.andExpect(jsonPath("$.requests", hasSize(1)))
				.andExpect(jsonPath("$.requests[0].category").value("pooled-funds"))
				.andExpect(jsonPath("$.requests[0].periodicContribution").value(5000.0))
				.andExpect(jsonPath("$.requests[0].annualLumpsum").value(5000.0))
				.andExpect(jsonPath("$.projection", hasSize(2)))
				.andExpect(jsonPath("$.projection[0].contributionValue").value(60000.0))
				.andExpect(jsonPath("$.projection[0].lumpsumValue").value(105000.0));
	}

	@Test
	void unknownGrowthRateCategoryIsRejected() throws Exception {
		String payload = """
				{ "snapshot": { "holdings": [] }, "growthRates": { "tulips": 5 }, "years": 2 }
				""";

		mockMvc.perform(post("/api/projections/snapshot")
						.contentType("application/json")
						.content(payload))
				.andExpect(status().isBadRequest())
				.andExpect(jsonPath("$.field").value("growthRates.tulips"));
	}
}
