/**
 * Exception handlers, their registry, and the guard calling them.<p>
 * 
 * Unless documented differently, all methods within this package expect to be
 * given non-null arguments and will return non-null results.
 */
package alpha.faultdispatch.handler;
