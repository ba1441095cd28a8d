package com.gt.dailyprep.model;

// Row 1 is the header, so the first data row is row 2. Row 0 means the file as a whole could not be read.
public record ImportError(int row, String error) { }
