@NullMarked
package ai.lspgateway.lifecycle;

import org.jspecify.annotations.NullMarked;
