package com.raditha.astcore.model;

/**
 * Numeric range annotations attached to a declaration token,
 * such as a low or high limit supplied by a source attribute.
 */
public enum RangeAttribute {
    LOW,
    HIGH
}
