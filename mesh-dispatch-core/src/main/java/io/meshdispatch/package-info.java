/**
 * Mesh-radio delivery dispatch core.
 *
 * <p>{@link io.meshdispatch.MeshDispatch} wires the components; dispatcher commands and
 * radio frame handling go through {@link io.meshdispatch.DispatchCoordinator}. Failures
 * surface as subclasses of {@link io.meshdispatch.DispatchException}.
 */
package io.meshdispatch;
