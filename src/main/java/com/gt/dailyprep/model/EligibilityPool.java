package com.gt.dailyprep.model;

// Listed in replacement and redistribution priority order
public enum EligibilityPool {
    New,
    Review,
    Mastered
}
