/**
 * Threading helpers shared by the poller.
 */
package botupdates.util;
