package com.ai.clinicbot.utils;

/**
 * Result of yes/no classification of a patient reply.
 */
public enum YesNoResult {
    YES,
    NO,
    UNKNOWN
}
