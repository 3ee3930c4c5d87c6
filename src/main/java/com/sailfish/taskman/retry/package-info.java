/**
 * Contains interfaces and implementations related to connection retry strategies,
 * such as {@link com.sailfish.taskman.retry.RetryStrategy} and the default
 * {@link com.sailfish.taskman.retry.ExponentialBackoffRetryStrategy}.
 */
package com.sailfish.taskman.retry;
