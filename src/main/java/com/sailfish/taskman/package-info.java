/**
 * Provides the entry point of the command-line task manager.
 * Tasks live in a relational table; the service layer mirrors them in memory for listing,
 * filtering and sorting.
 */
package com.sailfish.taskman;
