package my.wealthtracker.app.service;

import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.Well19937c;

import java.security.SecureRandom;

public class Well19937cRandomSourceFactory implements RandomSourceFactory {
	private final SecureRandom seeds = new SecureRandom();

	@Override
	public RandomGenerator create(long seed) {
		return new Well19937c(seed);
	}

	@Override
	public long newSeed() {
		return seeds.nextLong();
	}
}
