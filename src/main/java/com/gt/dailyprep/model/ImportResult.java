package com.gt.dailyprep.model;

import java.util.List;

public record ImportResult(int imported, int duplicates, List<ImportError> errors) { }
