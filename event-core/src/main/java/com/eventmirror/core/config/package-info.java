/**
 * Configuration loading and validation for the ingestion server.
 *
 * <p>
 * Settings are defined in YAML and loaded by
 * {@link com.eventmirror.core.config.SettingsLoader} into a
 * {@link com.eventmirror.core.config.CollectorSettings} instance. Validation
 * runs right after parsing so bad settings fail fast.
 * </p>
 *
 * @since 1.0.0
 */
package com.eventmirror.core.config;
