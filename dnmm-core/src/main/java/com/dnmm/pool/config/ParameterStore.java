package com.dnmm.pool.config;

/**
 * Read side of the governance parameter store. The engine takes one snapshot per call; changes only land
 * between calls.
 */
public interface ParameterStore {

  DnmmProperties current();
}
