package com.dnmm.pool.recenter;

public enum RecenterTrigger {
  AUTO,
  MANUAL,
}
