/**
 * Startup health checks for the server fleet.
 */
package me.internalizable.testenv.environment.readiness;
