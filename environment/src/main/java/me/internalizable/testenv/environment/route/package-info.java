/**
 * Route and mount tables handed to the server fleet.
 *
 * @see me.internalizable.testenv.environment.route.HarnessRoutes
 */
package me.internalizable.testenv.environment.route;
