package my.wealthtracker.app.service;

import org.apache.commons.math3.random.RandomGenerator;

public interface RandomSourceFactory {
	RandomGenerator create(long seed);

	long newSeed();
}
