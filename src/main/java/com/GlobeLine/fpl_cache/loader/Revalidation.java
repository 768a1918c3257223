package com.GlobeLine.fpl_cache.loader;

/**
 * Outcome of a revalidation call. A changed outcome may carry the new data when the
 * source returned it as part of the check; otherwise the caller performs a full load.
 */
public record Revalidation(boolean changed, LoadResult result) {

	private static final Revalidation UNCHANGED = new Revalidation(false, null);

	public static Revalidation unchanged() {
		return UNCHANGED;
	}

	public static Revalidation changed(LoadResult result) {
		return new Revalidation(true, result);
	}

	public static Revalidation changedWithoutPayload() {
		return new Revalidation(true, null);
	}
}
