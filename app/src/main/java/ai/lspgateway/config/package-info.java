@NullMarked
package ai.lspgateway.config;

import org.jspecify.annotations.NullMarked;
