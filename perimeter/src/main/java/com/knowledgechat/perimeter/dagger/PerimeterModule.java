package com.knowledgechat.perimeter.dagger;

import com.knowledgechat.perimeter.cipher.KeyDerivation;
import com.knowledgechat.perimeter.cipher.ScryptKeyDerivation;
import com.knowledgechat.perimeter.config.PatternWeakValueDetector;
import com.knowledgechat.perimeter.config.WeakValueDetector;
import dagger.Binds;
import dagger.Module;

/**
 * Binds the default implementations of the perimeter seams.
 */
@Module(includes = PerimeterModule.Binder.class)
public class PerimeterModule {

  /**
   * Instantiates a new Perimeter module.
   */
  public PerimeterModule() {
    // Default constructor
  }

  /**
   * The interface Binder.
   */
  @Module
  interface Binder {

    /**
     * Key derivation.
     *
     * @param keyDerivation the scrypt derivation
     * @return the key derivation
     */
    @Binds
    KeyDerivation keyDerivation(ScryptKeyDerivation keyDerivation);

    /**
     * Weak value detector.
     *
     * @param detector the pattern detector
     * @return the weak value detector
     */
    @Binds
    WeakValueDetector weakValueDetector(PatternWeakValueDetector detector);
  }
}
