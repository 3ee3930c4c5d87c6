/**
 * In-memory filtering and stable sorting of task lists.
 */
package com.sailfish.taskman.query;
